package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 一对匹配片段，两侧都是 [start, end) 字符区间
 */
@Value
@Jacksonized
@Builder
@AllArgsConstructor
public class MatchedSpan {

    @JsonProperty("source_start")
    int sourceStart;

    @JsonProperty("source_end")
    int sourceEnd;

    @JsonProperty("target_start")
    int targetStart;

    @JsonProperty("target_end")
    int targetEnd;

    public int sourceLength() {
        return sourceEnd - sourceStart;
    }
}
