package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 风险等级，只由原创性分数决定：85 / 70 / 50
 */
public enum RiskLevel {
    LOW(85),
    MEDIUM(70),
    HIGH(50),
    CRITICAL(0);

    private final int lowerBound;

    RiskLevel(int lowerBound) {
        this.lowerBound = lowerBound;
    }

    public int getLowerBound() {
        return lowerBound;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromScore(double originalityScore) {
        for (RiskLevel level : values()) {
            if (originalityScore >= level.lowerBound) return level;
        }
        return CRITICAL;
    }
}
