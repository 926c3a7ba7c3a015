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
public class SubmissionInput {

    @JsonProperty("submission_id")
    String submissionId;

    @JsonProperty("author_id")
    String authorId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("files")
    List<ExtractedFile> files;
}
