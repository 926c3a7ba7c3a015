package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 机器生成可能性的分档，固定阈值 70 / 50 / 30
 */
public enum AuthorshipCategory {
    AI_GENERATED(70),
    HEAVILY_ASSISTED(50),
    LIGHTLY_ASSISTED(30),
    HUMAN_WRITTEN(0);

    private final int lowerBound;

    AuthorshipCategory(int lowerBound) {
        this.lowerBound = lowerBound;
    }

    public int getLowerBound() {
        return lowerBound;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuthorshipCategory fromConfidence(double confidence) {
        for (AuthorshipCategory category : values()) {
            if (confidence >= category.lowerBound) return category;
        }
        return HUMAN_WRITTEN;
    }
}
