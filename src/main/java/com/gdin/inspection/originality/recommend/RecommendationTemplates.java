package com.gdin.inspection.originality.recommend;

import com.gdin.inspection.originality.models.AuthorshipCategory;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.RiskLevel;
import com.gdin.inspection.originality.models.SubsystemAvailability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 确定性的建议模板，文本生成不可用时兜底，结果永不为空
 */
public final class RecommendationTemplates {

    private RecommendationTemplates() {}

    /** 低于该分数时附加后续处理计划 */
    static final double NEXT_STEPS_BELOW = 70.0;

    /** 单元 AI 置信度达到该值才单列为作者身份问题 */
    static final double AUTHORSHIP_CONCERN = AuthorshipCategory.HEAVILY_ASSISTED.getLowerBound();

    private static final int EVIDENCE_LIMIT = 3;

    public static List<String> fallback(RecommendationContext context) {
        List<String> out = new ArrayList<>();
        out.add(overallAssessment(context.getOriginalityScore(), context.getRiskLevel()));
        for (Finding finding : findings(context)) {
            out.add(finding.render());
        }
        out.addAll(availabilityNotes(context.getAvailability()));
        out.addAll(bestPractices(context.isCodeSubmission()));
        if (context.getOriginalityScore() < NEXT_STEPS_BELOW) {
            out.add(nextSteps());
        }
        return out;
    }

    public static String overallAssessment(double score, RiskLevel level) {
        String s = formatScore(score);
        return switch (level) {
            case LOW -> "总体评估：原创性良好（" + s + " 分），未发现明显的学术诚信问题。";
            case MEDIUM -> "总体评估：存在轻微疑点（" + s + " 分），建议教师复核下列相关片段。";
            case HIGH -> "总体评估：风险较高（" + s + " 分），需要人工复核并与学生面谈。";
            case CRITICAL -> "总体评估：风险严重（" + s + " 分），建议立即启动学术诚信调查。";
        };
    }

    public static List<Finding> findings(RecommendationContext context) {
        List<Finding> findings = new ArrayList<>();

        List<AuthorshipVerdict> concerning = context.getAuthorshipVerdicts().stream()
                .filter(v -> v.getConfidence() >= AUTHORSHIP_CONCERN)
                .sorted(Comparator.comparingDouble(AuthorshipVerdict::getConfidence).reversed())
                .collect(Collectors.toList());
        if (!concerning.isEmpty()) {
            String evidence = concerning.size() + " 个单元疑似由 AI 生成或大量辅助："
                    + concerning.stream().limit(EVIDENCE_LIMIT)
                    .map(v -> v.getUnit() + "（" + formatScore(v.getConfidence()) + "，" + v.getCategory().getValue() + "）")
                    .collect(Collectors.joining("、"));
            findings.add(new Finding(FindingCategory.AUTHORSHIP, evidence, List.of(
                    "请学生当面讲解上述单元的实现思路与关键细节",
                    "要求学生提供编写过程记录（草稿、提交历史或调试记录）",
                    "对照课程关于 AI 工具使用的规定，确认是否需要声明")));
        }

        List<InternalPairFinding> flagged = context.getInternalPairs().stream()
                .filter(InternalPairFinding::isFlagged)
                .collect(Collectors.toList());
        if (!flagged.isEmpty()) {
            String evidence = flagged.size() + " 对文件内容高度重复："
                    + flagged.stream().limit(EVIDENCE_LIMIT)
                    .map(p -> p.getFirstUnit() + " 与 " + p.getSecondUnit() + "（" + percent(p.getWeight()) + "）")
                    .collect(Collectors.joining("、"));
            findings.add(new Finding(FindingCategory.INTERNAL_DUPLICATION, evidence, List.of(
                    "核对重复文件是否为同一答案的多次提交或复制粘贴",
                    "确认作业要求中各部分是否应独立完成")));
        }

        List<CrossSubmissionHit> hits = context.getCrossSubmissionHits();
        if (!hits.isEmpty()) {
            long sources = hits.stream().map(CrossSubmissionHit::getSubmissionId).distinct().count();
            String evidence = "与 " + sources + " 份历史提交相似："
                    + hits.stream().limit(EVIDENCE_LIMIT)
                    .map(h -> h.getSourceUnit() + " ↔ " + h.getSubmissionId() + "（" + percent(h.getSimilarity()) + "）")
                    .collect(Collectors.joining("、"));
            findings.add(new Finding(FindingCategory.CROSS_SUBMISSION, evidence, List.of(
                    "人工比对相似片段，排除公共模板与题目给定代码",
                    "如确认抄袭，联系相关提交的作者分别核实",
                    "按课程学术诚信规定记录并处理")));
        }
        return findings;
    }

    public static List<String> availabilityNotes(SubsystemAvailability availability) {
        if (availability == null) return List.of();
        List<String> notes = new ArrayList<>();
        if (!availability.isCrossSubmissionChecked()) {
            notes.add("说明：本次未能完成跨提交检索，分数未包含该项，请结合人工判断。");
        }
        if (!availability.isInternalComparisonCompleted()) {
            notes.add("说明：本次未能完成文件间比对，分数未包含该项。");
        }
        if (!availability.isAuthorshipClassified()) {
            notes.add("说明：部分单元未能在时限内完成 AI 生成判定，相关结论仅供参考。");
        } else if (availability.isAuthorshipDegraded()) {
            notes.add("说明：部分单元的 AI 生成判定使用了启发式估计，置信度较低。");
        }
        return notes;
    }

    public static List<String> bestPractices(boolean code) {
        if (code) {
            return List.of(
                    "建议：算法思路相同并不等于抄袭，应重点关注实现细节与注释是否雷同。",
                    "建议：要求学生保留版本管理提交记录，便于还原编写过程。",
                    "建议：在作业说明中明确 AI 编程助手的允许范围与声明方式。");
        }
        return List.of(
                "建议：引用他人观点时要求注明出处，并区分直接引用与转述。",
                "建议：要求学生保留提纲与草稿，便于还原写作过程。",
                "建议：在作业说明中明确 AI 写作工具的允许范围与声明方式。");
    }

    public static String nextSteps() {
        return String.join("\n",
                "后续步骤：",
                "1. 逐条核对报告中的相似片段与 AI 判定依据",
                "2. 与学生面谈，了解完成过程",
                "3. 根据面谈结果确定是否属于违规",
                "4. 按课程规定给出处理意见并记录",
                "5. 对全班重申学术诚信与 AI 工具使用要求");
    }

    /**
     * 提供给文本生成协作方的事实摘要
     */
    public static String findingsSummary(RecommendationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("原创性分数：").append(formatScore(context.getOriginalityScore())).append('\n');
        sb.append("风险等级：").append(context.getRiskLevel().getValue()).append('\n');
        sb.append("提交类型：").append(context.isCodeSubmission() ? "代码" : "文字").append('\n');
        List<Finding> findings = findings(context);
        if (findings.isEmpty()) {
            sb.append("未发现明显问题。\n");
        }
        for (Finding finding : findings) {
            sb.append(finding.category().name().toLowerCase(Locale.ROOT)).append("：")
                    .append(finding.evidence()).append('\n');
        }
        for (String note : availabilityNotes(context.getAvailability())) {
            sb.append(note).append('\n');
        }
        return sb.toString();
    }

    static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }

    static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100.0);
    }
}
