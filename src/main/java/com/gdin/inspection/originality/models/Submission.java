package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Submission {

    @JsonProperty("id")
    String id;

    @JsonProperty("author_id")
    String authorId;

    /** 只包含可分析的单元，顺序与输入一致 */
    @JsonProperty("units")
    List<ContentUnit> units;

    @JsonProperty("created_at")
    Instant createdAt;
}
