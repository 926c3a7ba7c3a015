package com.gdin.inspection.originality.authorship;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.originality.authorship.prompts.AuthorshipPromptsZh;
import com.gdin.inspection.originality.collaborator.CollaboratorCalls;
import com.gdin.inspection.originality.collaborator.GenerationConstraints;
import com.gdin.inspection.originality.collaborator.TextGenerationClient;
import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.MalformedResponseException;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.RationaleEntry;
import com.gdin.inspection.originality.models.ResolutionStage;
import com.gdin.inspection.originality.util.TokenUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 单元级 AI 生成判定：廉价初筛，必要时深度分析，外部调用失败退回启发式。
 * 每个单元一定会得到一个判定。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorshipClassifier {

    private final TextGenerationClient textGenerationClient;
    private final CollaboratorCalls collaboratorCalls;
    private final HeuristicAuthorshipEstimator heuristicEstimator;
    private final TokenUtil tokenUtil;
    private final OriginalityProperties originalityProperties;

    public AuthorshipVerdict classify(ContentUnit unit) {
        AuthorshipClassification classification = new AuthorshipClassification(unit.reference());
        HeuristicEstimate heuristic = heuristicEstimator.estimate(unit);
        String content = tokenUtil.truncate(unit.getRawText(), originalityProperties.getAuthorship().getUnitMaxTokens());

        TriageOutcome outcome;
        try {
            String prompt = fill(AuthorshipPromptsZh.TRIAGE_PROMPT_ZH, unit, content);
            String raw = collaboratorCalls.call("authorship-triage " + unit.reference(),
                    () -> textGenerationClient.complete(prompt, GenerationConstraints.quickJson("authorship-triage")));
            outcome = triageParser().parse(raw);
        } catch (SubsystemUnavailableException e) {
            log.warn("单元 {} 初筛不可用 [{}]，改用启发式估计", unit.reference(), e.getReason());
            return classification.fallBack(heuristicVerdict(unit, heuristic));
        }
        classification.triaged(outcome);

        if (outcome instanceof TriageOutcome.ObviouslyAi ai) {
            log.debug("单元 {} 初筛判定为 AI 生成，置信度 {}", unit.reference(), ai.score());
            return classification.resolveByTriage(triageVerdict(unit, ai.score(),
                    StrUtil.blankToDefault(ai.reason(), "初筛：明显由 AI 生成")));
        }
        if (outcome instanceof TriageOutcome.ObviouslyHuman human) {
            log.debug("单元 {} 初筛判定为本人完成，置信度 {}", unit.reference(), human.score());
            return classification.resolveByTriage(triageVerdict(unit, human.score(),
                    StrUtil.blankToDefault(human.reason(), "初筛：明显由本人完成")));
        }
        if (outcome instanceof TriageOutcome.Unknown unknown) {
            log.info("单元 {} 初筛结论无法识别，进入深度分析: {}", unit.reference(),
                    StrUtil.maxLength(StrUtil.nullToEmpty(unknown.raw()), 200));
        }

        try {
            String prompt = fill(AuthorshipPromptsZh.DEEP_ANALYSIS_PROMPT_ZH, unit, content);
            DeepAnalysis analysis = collaboratorCalls.call("authorship-deep " + unit.reference(),
                    () -> DeepAnalysisResponseParser.parse(textGenerationClient.complete(prompt,
                            GenerationConstraints.deliberateJson("authorship-deep"))));
            classification.deepAnalyzed(deepVerdict(unit, analysis, heuristic));
            return classification.complete();
        } catch (SubsystemUnavailableException e) {
            log.warn("单元 {} 深度分析不可用 [{}]，改用启发式估计", unit.reference(), e.getReason());
        } catch (MalformedResponseException e) {
            log.warn("单元 {} 深度分析输出无法解析: {}，改用启发式估计", unit.reference(), e.getMessage());
        }
        return classification.fallBack(heuristicVerdict(unit, heuristic));
    }

    /**
     * 纯启发式判定，流水线超时未完成的单元也用它补位
     */
    public AuthorshipVerdict heuristicVerdict(ContentUnit unit) {
        return heuristicVerdict(unit, heuristicEstimator.estimate(unit));
    }

    private AuthorshipVerdict heuristicVerdict(ContentUnit unit, HeuristicEstimate heuristic) {
        List<RationaleEntry> rationale = new ArrayList<>();
        if (unit.isCode()) {
            rationale.add(entry("comment_density", heuristic.commentSignal() * 100.0, "注释行占比"));
        }
        rationale.add(entry("identifier_entropy", heuristic.namingSignal() * 100.0, "命名多样性与平均长度"));
        rationale.add(entry("line_length_uniformity", heuristic.uniformitySignal() * 100.0, "行长整齐程度"));
        return AuthorshipVerdict.builder()
                .unit(unit.reference())
                .confidence(heuristic.confidence())
                .rationale(rationale)
                .resolvedBy(ResolutionStage.HEURISTIC)
                .degradedConfidence(true)
                .build();
    }

    private static AuthorshipVerdict triageVerdict(ContentUnit unit, double score, String reason) {
        return AuthorshipVerdict.builder()
                .unit(unit.reference())
                .confidence(score)
                .rationale(List.of(entry("triage", score, reason)))
                .resolvedBy(ResolutionStage.TRIAGE)
                .build();
    }

    private static AuthorshipVerdict deepVerdict(ContentUnit unit, DeepAnalysis analysis, HeuristicEstimate heuristic) {
        double weighted = 0.0;
        boolean degraded = false;
        List<RationaleEntry> rationale = new ArrayList<>();
        for (AuthorshipDimension dimension : AuthorshipDimension.values()) {
            Double score = analysis.scores().get(dimension);
            String evidence = analysis.evidence().get(dimension);
            if (score == null) {
                degraded = true;
                score = heuristic.dimensionScore(dimension);
                evidence = "模型未给出该维度，按启发式估计补位";
            }
            weighted += dimension.getWeight() * score / 100.0;
            rationale.add(entry(dimension.getKey(), score, StrUtil.nullToEmpty(evidence)));
        }
        return AuthorshipVerdict.builder()
                .unit(unit.reference())
                .confidence(weighted)
                .rationale(rationale)
                .resolvedBy(ResolutionStage.DEEP_ANALYSIS)
                .degradedConfidence(degraded)
                .toolSignature(analysis.toolSignature())
                .build();
    }

    private TriageResponseParser triageParser() {
        OriginalityProperties.Authorship config = originalityProperties.getAuthorship();
        return new TriageResponseParser(config.getTriageAiDefault(), config.getTriageHumanDefault());
    }

    private static String fill(String template, ContentUnit unit, String content) {
        return template
                .replace("{file_name}", unit.reference())
                .replace("{content_kind}", unit.getContentKind().getValue())
                .replace("{content}", content);
    }

    private static RationaleEntry entry(String dimension, double score, String evidence) {
        return RationaleEntry.builder()
                .dimension(dimension)
                .dimensionScore(Math.round(score * 10.0) / 10.0)
                .evidence(evidence)
                .build();
    }
}
