package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RationaleEntry {

    @JsonProperty("dimension")
    String dimension;

    @JsonProperty("dimension_score")
    double dimensionScore;

    @JsonProperty("evidence")
    String evidence;
}
