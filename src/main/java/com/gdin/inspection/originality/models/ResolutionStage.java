package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 判定最终由哪个阶段给出
 */
public enum ResolutionStage {
    TRIAGE,
    DEEP_ANALYSIS,
    HEURISTIC;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
