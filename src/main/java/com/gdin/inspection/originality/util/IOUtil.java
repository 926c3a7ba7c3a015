package com.gdin.inspection.originality.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private IOUtil() {}

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return jsonSerialize(obj, false);
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserialize(String content, Class<T> clazz) throws IOException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }

    public static <T> T jsonDeserialize(InputStream is, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(is, clazz);
    }
}
