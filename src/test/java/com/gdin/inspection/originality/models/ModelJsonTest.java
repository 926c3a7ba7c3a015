package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.inspection.originality.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class ModelJsonTest {

    @Test
    public void testReadUpstreamSubmission() throws Exception {
        SubmissionInput input;
        try (InputStream is = getClass().getResourceAsStream("/fixtures/submission-input.json")) {
            assertNotNull(is);
            input = IOUtil.jsonDeserialize(is, SubmissionInput.class);
        }

        assertEquals("2026-ds-hw3-0042", input.getSubmissionId());
        assertEquals(Instant.parse("2026-03-01T08:00:00Z"), input.getCreatedAt());
        assertEquals(3, input.getFiles().size());
        assertEquals(ContentKind.CODE, input.getFiles().get(0).getContentKind());
        assertEquals(ContentKind.NATURAL_LANGUAGE, input.getFiles().get(1).getContentKind());
        assertEquals(ContentKind.UNKNOWN, input.getFiles().get(2).getContentKind());
    }

    @Test
    public void testReportIsWrittenInSnakeCase() throws Exception {
        OriginalityReport report = OriginalityReport.builder()
                .reportId("r-1")
                .submissionId("s-1")
                .authorId("a-1")
                .originalityScore(132.0)
                .authorshipVerdicts(List.of(AuthorshipVerdict.builder()
                        .unit("main.py")
                        .confidence(64.0)
                        .resolvedBy(ResolutionStage.DEEP_ANALYSIS)
                        .rationale(List.of(RationaleEntry.builder()
                                .dimension("documentation_style").dimensionScore(80).evidence("注释模板化").build()))
                        .build()))
                .similarityMatches(List.of(SimilarityMatch.builder()
                        .sourceUnit("main.py").target("old-7").score(0.8).kind(MatchKind.SEMANTIC)
                        .spans(List.of(new MatchedSpan(0, 10, 5, 15)))
                        .build()))
                .generatedAt(Instant.parse("2026-03-01T08:00:00Z"))
                .availability(SubsystemAvailability.builder().crossSubmissionChecked(true).build())
                .branchSeconds(Map.of("total", 1.5))
                .build();

        JsonNode json = IOUtil.mapper().readTree(IOUtil.jsonSerialize(report));

        assertEquals(100.0, json.get("originality_score").asDouble(), 1e-9);
        assertEquals("low", json.get("risk_level").asText());
        assertEquals("2026-03-01T08:00:00Z", json.get("generated_at").asText());
        JsonNode verdict = json.get("authorship_verdicts").get(0);
        assertEquals("heavily_assisted", verdict.get("category").asText());
        assertEquals("deep_analysis", verdict.get("resolved_by").asText());
        assertFalse(verdict.has("tool_signature"));
        assertEquals("semantic", json.get("similarity_matches").get(0).get("kind").asText());
        assertEquals(5, json.get("similarity_matches").get(0).get("spans").get(0).get("target_start").asInt());
        assertTrue(json.get("availability").get("cross_submission_checked").asBoolean());

        OriginalityReport back = IOUtil.jsonDeserialize(IOUtil.jsonSerialize(report), OriginalityReport.class);
        assertEquals(report, back);
    }

    @Test
    public void testDerivedFieldsCannotContradictScores() {
        AuthorshipVerdict verdict = AuthorshipVerdict.builder()
                .unit("x.py").confidence(-5).category(AuthorshipCategory.AI_GENERATED).build();
        assertEquals(0.0, verdict.getConfidence(), 1e-9);
        assertEquals(AuthorshipCategory.HUMAN_WRITTEN, verdict.getCategory());

        OriginalityReport report = OriginalityReport.builder().originalityScore(60).riskLevel(RiskLevel.LOW).build();
        assertEquals(RiskLevel.HIGH, report.getRiskLevel());
        assertTrue(report.getRecommendations().isEmpty());

        assertThrows(IllegalStateException.class, () -> SimilarityMatch.builder()
                .sourceUnit("a").target("b").score(0.5).kind(MatchKind.LEXICAL).build());
    }
}
