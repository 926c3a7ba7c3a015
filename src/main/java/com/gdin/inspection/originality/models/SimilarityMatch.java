package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimilarityMatch {

    @JsonProperty("source_unit")
    String sourceUnit;

    /** 同一提交内的另一个单元，或外部提交 id */
    @JsonProperty("target")
    String target;

    /** 仅外部提交有值 */
    @JsonProperty("target_author")
    String targetAuthor;

    @JsonProperty("score")
    double score;

    @JsonProperty("kind")
    MatchKind kind;

    @JsonProperty("spans")
    List<MatchedSpan> spans;

    @JsonProperty("truncated")
    boolean truncated;

    public static class SimilarityMatchBuilder {
        public SimilarityMatch build() {
            if (spans == null || spans.isEmpty()) {
                throw new IllegalStateException("SimilarityMatch 至少需要一个匹配片段: " + sourceUnit + " -> " + target);
            }
            double clamped = Math.max(0.0, Math.min(1.0, score));
            return new SimilarityMatch(sourceUnit, target, targetAuthor, clamped, kind, List.copyOf(spans), truncated);
        }
    }
}
