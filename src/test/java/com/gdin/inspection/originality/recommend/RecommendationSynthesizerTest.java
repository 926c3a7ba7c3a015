package com.gdin.inspection.originality.recommend;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.ResolutionStage;
import com.gdin.inspection.originality.models.RiskLevel;
import com.gdin.inspection.originality.models.SubsystemAvailability;
import com.gdin.inspection.originality.support.ScriptedTextGenerationClient;
import com.gdin.inspection.originality.support.TestFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class RecommendationSynthesizerTest {

    private static final String PURPOSE = "recommendation-elaboration";

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final OriginalityProperties properties = TestFixtures.properties();
    private final ScriptedTextGenerationClient client = new ScriptedTextGenerationClient();
    private final RecommendationSynthesizer synthesizer =
            new RecommendationSynthesizer(client, TestFixtures.calls(executor, properties));

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static SubsystemAvailability fullyAvailable() {
        return SubsystemAvailability.builder()
                .internalComparisonCompleted(true)
                .crossSubmissionChecked(true)
                .authorshipClassified(true)
                .build();
    }

    private static RecommendationContext risky() {
        return RecommendationContext.builder()
                .originalityScore(42.0)
                .riskLevel(RiskLevel.CRITICAL)
                .codeSubmission(true)
                .internalPair(InternalPairFinding.builder()
                        .firstUnit("sort_v1.py").secondUnit("sort_v2.py").weight(0.93).flagged(true).build())
                .authorshipVerdict(AuthorshipVerdict.builder()
                        .unit("main.py").confidence(88).resolvedBy(ResolutionStage.TRIAGE).build())
                .availability(fullyAvailable())
                .build();
    }

    @Test
    public void testElaboratedRecommendationsKeepOnlyDetectedCategories() {
        client.reply(PURPOSE, """
                {
                  "overall_assessment": "总体评估：风险严重，main.py 明显由 AI 生成，两个排序文件几乎相同。",
                  "findings": [
                    {"category": "authorship", "evidence": "main.py 注释逐行复述代码", "actions": ["请学生现场讲解 main.py"]},
                    {"category": "cross_submission", "evidence": "与往届作业雷同", "actions": ["比对往届"]}
                  ],
                  "best_practices": ["要求保留 git 提交记录"]
                }
                """);

        RecommendationResult result = synthesizer.synthesize(risky());
        log.info("recommendations: {}", result.recommendations());

        assertTrue(result.elaborated());
        List<String> lines = result.recommendations();
        assertTrue(lines.get(0).startsWith("总体评估："));
        assertEquals("【作者身份】main.py 注释逐行复述代码\n1. 请学生现场讲解 main.py", lines.get(1));
        // 模型漏掉的内部重复由模板补齐，未检测到的跨提交类别被丢弃
        assertTrue(lines.get(2).startsWith("【内部重复】"));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("【跨提交相似】")));
        assertTrue(lines.contains("建议：要求保留 git 提交记录"));
        assertTrue(lines.get(lines.size() - 1).startsWith("后续步骤："));
    }

    @Test
    public void testMalformedOutputFallsBackToTemplates() {
        client.reply(PURPOSE, "以下是我的建议：请认真复核。");

        RecommendationResult result = synthesizer.synthesize(risky());

        assertFalse(result.elaborated());
        assertEquals(RecommendationTemplates.fallback(risky()), result.recommendations());
        assertEquals(1, client.callCount(PURPOSE));
    }

    @Test
    public void testOutageFallsBackToTemplates() {
        client.fail(PURPOSE, new IllegalStateException("Connection refused"))
                .fail(PURPOSE, new IllegalStateException("Connection refused"));

        RecommendationResult result = synthesizer.synthesize(risky());

        assertFalse(result.elaborated());
        assertEquals(2, client.callCount(PURPOSE));
        assertTrue(result.recommendations().get(0).contains("风险严重"));
    }

    @Test
    public void testCleanSubmissionHasNoNextSteps() {
        RecommendationContext clean = RecommendationContext.builder()
                .originalityScore(96.0)
                .riskLevel(RiskLevel.LOW)
                .codeSubmission(false)
                .availability(fullyAvailable())
                .build();

        List<String> lines = RecommendationTemplates.fallback(clean);

        assertFalse(lines.isEmpty());
        assertTrue(lines.get(0).contains("原创性良好"));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("【")));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("后续步骤：")));
        assertTrue(lines.contains("建议：引用他人观点时要求注明出处，并区分直接引用与转述。"));
    }

    @Test
    public void testTemplatesReportSkippedSubsystemsAndCrossHits() {
        RecommendationContext context = RecommendationContext.builder()
                .originalityScore(65.0)
                .riskLevel(RiskLevel.HIGH)
                .codeSubmission(true)
                .crossSubmissionHit(CrossSubmissionHit.builder()
                        .sourceUnit("lab3.c").submissionId("2023-lab3-017").similarity(0.81).build())
                .availability(SubsystemAvailability.builder()
                        .internalComparisonCompleted(true)
                        .crossSubmissionChecked(true)
                        .authorshipClassified(true)
                        .authorshipDegraded(true)
                        .build())
                .build();

        List<String> lines = RecommendationTemplates.fallback(context);

        assertTrue(lines.stream().anyMatch(l -> l.startsWith("【跨提交相似】与 1 份历史提交相似：lab3.c ↔ 2023-lab3-017（81%）")));
        assertTrue(lines.contains("说明：部分单元的 AI 生成判定使用了启发式估计，置信度较低。"));
        assertTrue(lines.get(lines.size() - 1).startsWith("后续步骤："));
    }
}
