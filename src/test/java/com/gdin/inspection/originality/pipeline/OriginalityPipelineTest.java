package com.gdin.inspection.originality.pipeline;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.NoAnalyzableContentException;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.ContentKind;
import com.gdin.inspection.originality.models.ExtractedFile;
import com.gdin.inspection.originality.models.OriginalityReport;
import com.gdin.inspection.originality.models.ResolutionStage;
import com.gdin.inspection.originality.models.SubmissionInput;
import com.gdin.inspection.originality.support.InMemoryVectorStore;
import com.gdin.inspection.originality.support.ScriptedTextGenerationClient;
import com.gdin.inspection.originality.support.TestFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class OriginalityPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");
    private static final String HUMAN_TRIAGE =
            "{\"quick_verdict\": \"human_written\", \"confidence_level\": \"high\", \"initial_confidence\": 10}";

    private final ExecutorService analysisExecutor = Executors.newFixedThreadPool(4);
    private final ExecutorService callExecutor = Executors.newFixedThreadPool(4);
    private final OriginalityProperties properties = TestFixtures.properties();
    private final ScriptedTextGenerationClient client = new ScriptedTextGenerationClient();

    @AfterEach
    public void tearDown() {
        analysisExecutor.shutdownNow();
        callExecutor.shutdownNow();
    }

    private OriginalityPipeline pipeline(InMemoryVectorStore store) {
        return TestFixtures.pipeline(client, store, analysisExecutor, callExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    private static SubmissionInput input(String... nameTextPairs) {
        SubmissionInput.SubmissionInputBuilder builder = SubmissionInput.builder()
                .submissionId("sub-42")
                .authorId("student-7")
                .createdAt(NOW);
        List<ExtractedFile> files = new ArrayList<>();
        for (int i = 0; i < nameTextPairs.length; i += 2) {
            files.add(TestFixtures.file(nameTextPairs[i], nameTextPairs[i + 1], ContentKind.CODE));
        }
        return builder.files(files).build();
    }

    @Test
    public void testEndToEndWithDuplicatedFiles() {
        client.always("authorship-triage", () -> HUMAN_TRIAGE)
                .reply("recommendation-elaboration", "暂时无法给出建议");
        InMemoryVectorStore store = new InMemoryVectorStore().withIndexedCount(3);

        OriginalityReport report = pipeline(store).analyze(input(
                "a.py", "def add(a,b): return a+b",
                "b.py", "def add(x,y):\n    return x+y",
                "empty.py", "   \n"));
        log.info("report: {}", report);

        assertEquals("sub-42", report.getSubmissionId());
        assertEquals("student-7", report.getAuthorId());
        assertEquals(NOW, report.getGeneratedAt());
        assertEquals(1, report.getUnanalyzableUnits().size());
        assertEquals("empty.py", report.getUnanalyzableUnits().get(0).getUnit());

        assertEquals(1, report.getInternalPairs().size());
        assertTrue(report.getInternalPairs().get(0).isFlagged());
        double weight = report.getInternalPairs().get(0).getWeight();
        assertEquals(100.0 * (1 - weight) * 0.9, report.getOriginalityScore(), 1e-6);
        assertEquals(90.0, report.getAuthorshipScore(), 1e-6);

        assertEquals(2, report.getAuthorshipVerdicts().size());
        assertTrue(report.getAuthorshipVerdicts().stream().allMatch(v -> v.getResolvedBy() == ResolutionStage.TRIAGE));
        assertTrue(report.getAvailability().isInternalComparisonCompleted());
        assertTrue(report.getAvailability().isCrossSubmissionChecked());
        assertTrue(report.getAvailability().isAuthorshipClassified());
        assertFalse(report.getAvailability().isRecommendationsElaborated());

        assertFalse(report.getRecommendations().isEmpty());
        assertTrue(report.getRecommendations().stream().anyMatch(r -> r.startsWith("【内部重复】")));
        assertTrue(report.getRecommendations().get(report.getRecommendations().size() - 1).startsWith("后续步骤："));
        assertTrue(report.getBranchSeconds().containsKey("internal_comparison"));
        assertTrue(report.getBranchSeconds().containsKey("total"));
        assertTrue(store.written().isEmpty());
    }

    @Test
    public void testRetrievalOutageIsReportedAndExcluded() {
        client.always("authorship-triage", () -> HUMAN_TRIAGE)
                .always("recommendation-elaboration", () -> "无");
        InMemoryVectorStore store = new InMemoryVectorStore()
                .withIndexedCount(10)
                .failingSearch(new IllegalStateException("401 unauthorized"));

        OriginalityReport report = pipeline(store).analyze(input("main.py", TestFixtures.SCRAPPY_CODE));

        assertFalse(report.getAvailability().isCrossSubmissionChecked());
        assertTrue(report.getCrossSubmissionHits().isEmpty());
        assertEquals(0, report.getSourcesChecked());
        assertEquals(90.0, report.getOriginalityScore(), 1e-6);
        assertTrue(report.getRecommendations().contains("说明：本次未能完成跨提交检索，分数未包含该项，请结合人工判断。"));
    }

    @Test
    public void testNoAnalyzableContentIsRejected() {
        InMemoryVectorStore store = new InMemoryVectorStore();

        assertThrows(NoAnalyzableContentException.class,
                () -> pipeline(store).analyze(input("blank.py", "", "spaces.txt", " \t ")));
        assertEquals(0, store.searchCalls());
        assertEquals(0, client.callCount("authorship-triage"));
    }

    @Test
    public void testSlowAuthorshipMissesDeadline() {
        properties.getPipeline().setDeadline(Duration.ofMillis(1500));
        client.always("authorship-triage", () -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                    return HUMAN_TRIAGE;
                })
                .always("recommendation-elaboration", () -> "无");
        InMemoryVectorStore store = new InMemoryVectorStore().withIndexedCount(2);

        OriginalityReport report = pipeline(store).analyze(input("main.py", TestFixtures.TEXTBOOK_CODE));

        assertFalse(report.getAvailability().isAuthorshipClassified());
        assertTrue(report.getAvailability().isAuthorshipDegraded());
        AuthorshipVerdict verdict = report.getAuthorshipVerdicts().get(0);
        assertEquals(ResolutionStage.HEURISTIC, verdict.getResolvedBy());
        // 超时补位的判定不计入评分
        assertEquals(100.0, report.getAuthorshipScore(), 1e-9);
        assertTrue(report.getRecommendations().contains("说明：部分单元未能在时限内完成 AI 生成判定，相关结论仅供参考。"));
    }

    @Test
    public void testSubmissionIsIndexedWhenEnabled() {
        properties.getPipeline().setIndexAfterAnalysis(true);
        client.always("authorship-triage", () -> HUMAN_TRIAGE)
                .always("recommendation-elaboration", () -> "无");
        InMemoryVectorStore store = new InMemoryVectorStore().withIndexedCount(1);

        pipeline(store).analyze(input("main.py", TestFixtures.SCRAPPY_CODE));

        assertFalse(store.written().isEmpty());
        assertEquals("sub-42", store.written().get(0).getSubmissionId());
    }
}
