package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchKind {
    LEXICAL,
    STRUCTURAL,
    SEMANTIC;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
