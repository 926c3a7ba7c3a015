package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 原创性分析报告，一次性写入，重跑会生成新报告
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OriginalityReport {

    @JsonProperty("report_id")
    String reportId;

    @JsonProperty("submission_id")
    String submissionId;

    @JsonProperty("author_id")
    String authorId;

    @JsonProperty("originality_score")
    double originalityScore;

    /** 由 originality_score 推导 */
    @JsonProperty("risk_level")
    RiskLevel riskLevel;

    /** 只看重复（内部 + 跨提交）的分数 */
    @JsonProperty("duplication_score")
    double duplicationScore;

    /** 只看作者身份的分数 */
    @JsonProperty("authorship_score")
    double authorshipScore;

    @JsonProperty("similarity_matches")
    List<SimilarityMatch> similarityMatches;

    @JsonProperty("internal_pairs")
    List<InternalPairFinding> internalPairs;

    @JsonProperty("cross_submission_hits")
    List<CrossSubmissionHit> crossSubmissionHits;

    @JsonProperty("authorship_verdicts")
    List<AuthorshipVerdict> authorshipVerdicts;

    @JsonProperty("unanalyzable_units")
    List<UnanalyzableUnit> unanalyzableUnits;

    @JsonProperty("sources_checked")
    int sourcesChecked;

    @JsonProperty("recommendations")
    List<String> recommendations;

    @JsonProperty("generated_at")
    Instant generatedAt;

    @JsonProperty("availability")
    SubsystemAvailability availability;

    @JsonProperty("branch_seconds")
    Map<String, Double> branchSeconds;

    public static class OriginalityReportBuilder {
        public OriginalityReport build() {
            double score = clamp(originalityScore);
            return new OriginalityReport(reportId, submissionId, authorId, score, RiskLevel.fromScore(score),
                    clamp(duplicationScore), clamp(authorshipScore),
                    copy(similarityMatches), copy(internalPairs), copy(crossSubmissionHits),
                    copy(authorshipVerdicts), copy(unanalyzableUnits), sourcesChecked,
                    copy(recommendations), generatedAt, availability,
                    branchSeconds == null ? Map.of() : Map.copyOf(branchSeconds));
        }

        private static double clamp(double v) {
            return Math.max(0.0, Math.min(100.0, v));
        }

        private static <T> List<T> copy(List<T> list) {
            return list == null ? List.of() : List.copyOf(list);
        }
    }
}
