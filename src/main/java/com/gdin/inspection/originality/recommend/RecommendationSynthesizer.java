package com.gdin.inspection.originality.recommend;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.originality.collaborator.CollaboratorCalls;
import com.gdin.inspection.originality.collaborator.GenerationConstraints;
import com.gdin.inspection.originality.collaborator.TextGenerationClient;
import com.gdin.inspection.originality.exception.MalformedResponseException;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.recommend.prompts.RecommendationPromptsZh;
import com.gdin.inspection.originality.util.JsonExtractors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 生成有序建议列表：总体评估、分类问题与处理步骤、最佳实践，分数偏低时附后续计划。
 * 优先让文本生成协作方润色，失败或输出不合规时使用模板。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationSynthesizer {

    private final TextGenerationClient textGenerationClient;
    private final CollaboratorCalls collaboratorCalls;

    public RecommendationResult synthesize(RecommendationContext context) {
        String prompt = RecommendationPromptsZh.ELABORATION_PROMPT_ZH
                .replace("{submission_type}", context.isCodeSubmission() ? "代码" : "文字")
                .replace("{findings_summary}", RecommendationTemplates.findingsSummary(context));
        try {
            List<String> elaborated = collaboratorCalls.call("recommendation-elaboration",
                    () -> parse(textGenerationClient.complete(prompt,
                            GenerationConstraints.quickJson("recommendation-elaboration")), context));
            return new RecommendationResult(elaborated, true);
        } catch (SubsystemUnavailableException e) {
            log.warn("建议润色不可用 [{}]，使用模板建议", e.getReason());
        } catch (MalformedResponseException e) {
            log.warn("建议润色输出不合规: {}，使用模板建议", e.getMessage());
        }
        return new RecommendationResult(RecommendationTemplates.fallback(context), false);
    }

    /**
     * 只保留检测结果中实际存在的问题类别；模型漏掉的类别用模板补齐，保证每类问题都有处理步骤
     */
    static List<String> parse(String raw, RecommendationContext context) {
        JSONObject json = JsonExtractors.parseFirstJsonObject(raw);
        if (json == null) {
            throw new MalformedResponseException("elaboration output contains no JSON object");
        }
        String overall = json.getString("overall_assessment");
        if (StrUtil.isBlank(overall)) {
            throw new MalformedResponseException("elaboration output has no overall_assessment");
        }

        Map<FindingCategory, Finding> expected = new EnumMap<>(FindingCategory.class);
        for (Finding finding : RecommendationTemplates.findings(context)) {
            expected.put(finding.category(), finding);
        }

        Map<FindingCategory, Finding> elaborated = new EnumMap<>(FindingCategory.class);
        if (json.get("findings") instanceof JSONArray array) {
            for (Object item : array) {
                if (!(item instanceof JSONObject obj)) continue;
                FindingCategory category = FindingCategory.of(obj.getString("category"));
                if (category == null || !expected.containsKey(category) || elaborated.containsKey(category)) continue;
                String evidence = obj.getString("evidence");
                List<String> actions = strings(obj.get("actions"));
                if (StrUtil.isBlank(evidence) || actions.isEmpty()) continue;
                elaborated.put(category, new Finding(category, evidence.trim(), actions));
            }
        }

        List<String> out = new ArrayList<>();
        out.add(overall.trim());
        for (FindingCategory category : FindingCategory.values()) {
            Finding finding = elaborated.getOrDefault(category, expected.get(category));
            if (finding != null) out.add(finding.render());
        }
        out.addAll(RecommendationTemplates.availabilityNotes(context.getAvailability()));

        List<String> practices = strings(json.get("best_practices"));
        if (practices.isEmpty()) {
            out.addAll(RecommendationTemplates.bestPractices(context.isCodeSubmission()));
        } else {
            practices.forEach(p -> out.add("建议：" + p));
        }
        if (context.getOriginalityScore() < RecommendationTemplates.NEXT_STEPS_BELOW) {
            out.add(RecommendationTemplates.nextSteps());
        }
        return out;
    }

    private static List<String> strings(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof JSONArray array) {
            for (Object o : array) {
                if (o != null && StrUtil.isNotBlank(o.toString())) out.add(o.toString().trim());
            }
        }
        return out;
    }
}
