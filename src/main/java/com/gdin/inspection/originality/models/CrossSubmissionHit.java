package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 历史提交检索命中（按提交聚合，保留最高相似度）
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrossSubmissionHit {

    @JsonProperty("source_unit")
    String sourceUnit;

    @JsonProperty("submission_id")
    String submissionId;

    @JsonProperty("author_id")
    String authorId;

    @JsonProperty("similarity")
    double similarity;

    @JsonProperty("excerpt")
    String excerpt;
}
