package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentKind {
    CODE("code"),
    NATURAL_LANGUAGE("natural_language"),
    UNKNOWN("unknown");

    private final String value;

    ContentKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 宽松解析，上游抽取服务给的写法不统一（code / natural-language / text ...）
     */
    @JsonCreator
    public static ContentKind of(String raw) {
        if (raw == null) return UNKNOWN;
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (key) {
            case "code", "source", "source_code" -> CODE;
            case "natural_language", "text", "prose", "writeup" -> NATURAL_LANGUAGE;
            default -> UNKNOWN;
        };
    }
}
