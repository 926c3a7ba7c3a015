package com.gdin.inspection.originality.authorship;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.models.AuthorshipCategory;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.RationaleEntry;
import com.gdin.inspection.originality.models.ResolutionStage;
import com.gdin.inspection.originality.support.ScriptedTextGenerationClient;
import com.gdin.inspection.originality.support.TestFixtures;
import com.gdin.inspection.originality.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class AuthorshipClassifierTest {

    private static final String TRIAGE = "authorship-triage";
    private static final String DEEP = "authorship-deep";

    private static final String FULL_DEEP_ANALYSIS = """
            <think>先看注释，再看命名……</think>
            ```json
            {
              "dimensions": {
                "documentation_style": {"score": 80, "evidence": "每行都有注释"},
                "structure_formatting": {"score": 60, "evidence": "格式统一"},
                "naming_identifiers": {"score": 70, "evidence": "命名冗长规范"},
                "error_handling": {"score": 40, "evidence": "只有一处校验"},
                "complexity": {"score": 50, "evidence": "复杂度正常"},
                "personal_style": {"score": 30, "evidence": "有调试残留"}
              },
              "ai_tool_signature": "chatgpt"
            }
            ```
            """;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final OriginalityProperties properties = TestFixtures.properties();
    private final ScriptedTextGenerationClient client = new ScriptedTextGenerationClient();
    private final HeuristicAuthorshipEstimator heuristic = new HeuristicAuthorshipEstimator();
    private final AuthorshipClassifier classifier = new AuthorshipClassifier(client,
            TestFixtures.calls(executor, properties), heuristic, new TokenUtil(), properties);

    private final ContentUnit textbook = TestFixtures.code(0, "average.py", TestFixtures.TEXTBOOK_CODE);

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testObviousAiResolvesAtTriageWithoutDeepAnalysis() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"ai_generated\", \"confidence_level\": \"high\", "
                + "\"initial_confidence\": 92, \"reason\": \"逐行教科书式注释\"}");

        AuthorshipVerdict verdict = classifier.classify(textbook);

        assertEquals(92.0, verdict.getConfidence(), 1e-9);
        assertEquals(AuthorshipCategory.AI_GENERATED, verdict.getCategory());
        assertEquals(ResolutionStage.TRIAGE, verdict.getResolvedBy());
        assertFalse(verdict.isDegradedConfidence());
        assertEquals("逐行教科书式注释", verdict.getRationale().get(0).getEvidence());
        assertEquals(0, client.callCount(DEEP));
    }

    @Test
    public void testTriageScoresAreClampedIntoTheirBands() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"ai_generated\", \"confidence_level\": \"high\", \"initial_confidence\": 55}");
        assertEquals(70.0, classifier.classify(textbook).getConfidence(), 1e-9);

        client.reply(TRIAGE, "{\"quick_verdict\": \"human_written\", \"confidence_level\": \"high\", \"initial_confidence\": 45}");
        AuthorshipVerdict human = classifier.classify(textbook);
        assertEquals(29.0, human.getConfidence(), 1e-9);
        assertEquals(AuthorshipCategory.HUMAN_WRITTEN, human.getCategory());

        client.reply(TRIAGE, "{\"quick_verdict\": \"human_written\", \"confidence_level\": \"high\"}");
        assertEquals(10.0, classifier.classify(textbook).getConfidence(), 1e-9);
        assertEquals(0, client.callCount(DEEP));
    }

    @Test
    public void testUncertainTriageUsesWeightedDeepAnalysis() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"uncertain\", \"confidence_level\": \"low\", \"initial_confidence\": 50}")
                .reply(DEEP, FULL_DEEP_ANALYSIS);

        AuthorshipVerdict verdict = classifier.classify(textbook);
        log.info("deep verdict: {}", verdict);

        // 0.25*80 + 0.20*60 + 0.20*70 + 0.15*40 + 0.10*50 + 0.10*30
        assertEquals(60.0, verdict.getConfidence(), 1e-9);
        assertEquals(AuthorshipCategory.HEAVILY_ASSISTED, verdict.getCategory());
        assertEquals(ResolutionStage.DEEP_ANALYSIS, verdict.getResolvedBy());
        assertEquals("chatgpt", verdict.getToolSignature());
        assertFalse(verdict.isDegradedConfidence());
        assertEquals(6, verdict.getRationale().size());
        RationaleEntry first = verdict.getRationale().get(0);
        assertEquals("documentation_style", first.getDimension());
        assertEquals("每行都有注释", first.getEvidence());
    }

    @Test
    public void testUnrecognizedTriageVerdictProceedsToDeepAnalysis() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"probably_a_robot\", \"confidence_level\": \"high\"}")
                .reply(DEEP, FULL_DEEP_ANALYSIS);

        AuthorshipVerdict verdict = classifier.classify(textbook);

        assertEquals(1, client.callCount(DEEP));
        assertEquals(ResolutionStage.DEEP_ANALYSIS, verdict.getResolvedBy());
    }

    @Test
    public void testMissingDimensionsAreFilledAndMarkedDegraded() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"uncertain\"}")
                .reply(DEEP, "{\"confidence_breakdown\": {\"documentation_style\": 90, \"naming_identifiers\": 80}}");

        AuthorshipVerdict verdict = classifier.classify(textbook);
        HeuristicEstimate estimate = heuristic.estimate(textbook);

        double expected = 0.25 * 90 + 0.20 * 80
                + 0.20 * estimate.dimensionScore(AuthorshipDimension.STRUCTURE_FORMATTING)
                + 0.15 * estimate.confidence() + 0.10 * estimate.confidence() + 0.10 * estimate.confidence();
        assertTrue(verdict.isDegradedConfidence());
        assertEquals(ResolutionStage.DEEP_ANALYSIS, verdict.getResolvedBy());
        assertEquals(expected, verdict.getConfidence(), 1e-6);
        assertNull(verdict.getToolSignature());
    }

    @Test
    public void testDeepAnalysisFailureRetriesOnceThenFallsBackToHeuristic() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"uncertain\"}")
                .fail(DEEP, new IllegalStateException("503 service unavailable"))
                .fail(DEEP, new IllegalStateException("503 service unavailable"));

        AuthorshipVerdict verdict = classifier.classify(textbook);

        assertEquals(2, client.callCount(DEEP));
        assertEquals(ResolutionStage.HEURISTIC, verdict.getResolvedBy());
        assertTrue(verdict.isDegradedConfidence());
        assertEquals(heuristic.estimate(textbook).confidence(), verdict.getConfidence(), 1e-9);
    }

    @Test
    public void testMalformedDeepAnalysisFallsBackWithoutRetry() {
        client.reply(TRIAGE, "{\"quick_verdict\": \"uncertain\"}")
                .reply(DEEP, "抱歉，我无法判断这段代码。");

        AuthorshipVerdict verdict = classifier.classify(textbook);

        assertEquals(1, client.callCount(DEEP));
        assertEquals(ResolutionStage.HEURISTIC, verdict.getResolvedBy());
        assertTrue(verdict.isDegradedConfidence());
    }

    @Test
    public void testTriageOutageFallsBackWithoutDeepAnalysis() {
        client.fail(TRIAGE, new IllegalStateException("401 unauthorized"));

        AuthorshipVerdict verdict = classifier.classify(textbook);

        assertEquals(1, client.callCount(TRIAGE));
        assertEquals(0, client.callCount(DEEP));
        assertEquals(ResolutionStage.HEURISTIC, verdict.getResolvedBy());
        assertEquals("average.py", verdict.getUnit());
    }
}
