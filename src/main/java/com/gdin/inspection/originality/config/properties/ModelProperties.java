package com.gdin.inspection.originality.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.model")
@Component
public class ModelProperties implements Serializable {

    private Chat chat = new Chat();

    private Embedding embedding = new Embedding();

    @Data
    public static class Chat implements Serializable {
        private String baseUrl = "https://dashscope.aliyuncs.com/api/v1";
        private String apiKey;
        private String modelName = "qwen3-32b";
        /** 初筛、建议润色用低温度，结果更稳定 */
        private Float temperature = 0.2f;
        private Float thinkTemperature = 0.6f;
    }

    @Data
    public static class Embedding implements Serializable {
        private String baseUrl = "http://localhost:11434/";
        private String modelName = "quentinz/bge-large-zh-v1.5:latest";
    }
}
