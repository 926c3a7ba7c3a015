package com.gdin.inspection.originality.report;

import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.OriginalityReport;
import com.gdin.inspection.originality.models.RationaleEntry;
import com.gdin.inspection.originality.models.SimilarityMatch;
import com.gdin.inspection.originality.models.SubsystemAvailability;
import com.gdin.inspection.originality.models.UnanalyzableUnit;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 把报告渲染成 Markdown，交给外部展示层。不做任何 I/O
 */
@Component
public class MarkdownReportRenderer {

    public String render(OriginalityReport report) {
        StringBuilder sb = new StringBuilder();

        sb.append("# 原创性分析报告\n\n");
        sb.append("- 报告编号：").append(nullToDash(report.getReportId())).append('\n');
        sb.append("- 提交：").append(nullToDash(report.getSubmissionId()))
                .append("（作者 ").append(nullToDash(report.getAuthorId())).append("）\n");
        sb.append("- 生成时间：").append(report.getGeneratedAt() == null ? "-" : report.getGeneratedAt().toString()).append('\n');
        sb.append("- 原创性分数：**").append(score(report.getOriginalityScore())).append("**\n");
        sb.append("- 风险等级：**").append(report.getRiskLevel().getValue()).append("**\n");
        sb.append("- 重复分数：").append(score(report.getDuplicationScore()))
                .append("，作者身份分数：").append(score(report.getAuthorshipScore())).append('\n');
        sb.append("- 比对历史提交数：").append(report.getSourcesChecked()).append("\n\n");

        // 1. 子系统可用性
        SubsystemAvailability availability = report.getAvailability();
        if (availability != null) {
            sb.append("## 子系统状态\n\n");
            sb.append("| 子系统 | 状态 |\n|---|---|\n");
            row(sb, "文件间比对", availability.isInternalComparisonCompleted());
            row(sb, "跨提交检索", availability.isCrossSubmissionChecked());
            row(sb, "AI 生成判定", availability.isAuthorshipClassified());
            sb.append("| AI 判定降级 | ").append(availability.isAuthorshipDegraded() ? "是" : "否").append(" |\n");
            row(sb, "建议润色", availability.isRecommendationsElaborated());
            sb.append('\n');
        }

        // 2. 内部重复
        List<InternalPairFinding> pairs = report.getInternalPairs();
        if (!pairs.isEmpty()) {
            sb.append("## 文件间相似\n\n");
            sb.append("| 文件 A | 文件 B | 综合权重 | 词法 | 去注释词法 | 结构 | 标记 |\n|---|---|---|---|---|---|---|\n");
            for (InternalPairFinding p : pairs) {
                sb.append("| ").append(cell(p.getFirstUnit()))
                        .append(" | ").append(cell(p.getSecondUnit()))
                        .append(" | ").append(percent(p.getWeight()))
                        .append(" | ").append(percent(p.getLexicalScore()))
                        .append(" | ").append(percent(p.getStrippedLexicalScore()))
                        .append(" | ").append(p.isStructuralUsed() ? percent(p.getStructuralScore())
                                : (p.isParseFailed() ? "解析失败" : "-"))
                        .append(" | ").append(p.isFlagged() ? "重复" : "低置信")
                        .append(" |\n");
            }
            sb.append('\n');
        }

        // 3. 跨提交命中
        List<CrossSubmissionHit> hits = report.getCrossSubmissionHits();
        if (!hits.isEmpty()) {
            sb.append("## 跨提交相似\n\n");
            sb.append("| 本提交单元 | 历史提交 | 作者 | 相似度 |\n|---|---|---|---|\n");
            for (CrossSubmissionHit h : hits) {
                sb.append("| ").append(cell(h.getSourceUnit()))
                        .append(" | ").append(cell(h.getSubmissionId()))
                        .append(" | ").append(cell(h.getAuthorId()))
                        .append(" | ").append(percent(h.getSimilarity()))
                        .append(" |\n");
            }
            sb.append('\n');
        }

        // 4. 匹配片段概览，按类型计数
        List<SimilarityMatch> matches = report.getSimilarityMatches();
        if (!matches.isEmpty()) {
            Map<String, Integer> byKind = new TreeMap<>();
            for (SimilarityMatch m : matches) {
                byKind.merge(m.getKind() == null ? "unknown" : m.getKind().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
            sb.append("## 匹配片段\n\n");
            byKind.forEach((kind, count) -> sb.append("- ").append(kind).append("：").append(count).append(" 条\n"));
            long truncated = matches.stream().filter(SimilarityMatch::isTruncated).count();
            if (truncated > 0) {
                sb.append("- 其中 ").append(truncated).append(" 条因文本过长只比对了前段\n");
            }
            sb.append('\n');
        }

        // 5. AI 生成判定
        List<AuthorshipVerdict> verdicts = report.getAuthorshipVerdicts();
        if (!verdicts.isEmpty()) {
            sb.append("## AI 生成判定\n\n");
            for (AuthorshipVerdict v : verdicts) {
                sb.append("### ").append(v.getUnit()).append("\n\n");
                sb.append("置信度 ").append(score(v.getConfidence()))
                        .append("，类别 ").append(v.getCategory().getValue())
                        .append("，判定阶段 ").append(v.getResolvedBy() == null ? "-" : v.getResolvedBy().name().toLowerCase(Locale.ROOT));
                if (v.isDegradedConfidence()) sb.append("（降级）");
                Optional.ofNullable(v.getToolSignature()).ifPresent(t -> sb.append("，疑似工具 ").append(t));
                sb.append("\n\n");
                for (RationaleEntry r : v.getRationale()) {
                    sb.append("- ").append(r.getDimension()).append("：").append(score(r.getDimensionScore()));
                    if (r.getEvidence() != null && !r.getEvidence().isBlank()) sb.append("，").append(r.getEvidence());
                    sb.append('\n');
                }
                sb.append('\n');
            }
        }

        // 6. 无法分析的单元
        List<UnanalyzableUnit> unanalyzable = report.getUnanalyzableUnits();
        if (!unanalyzable.isEmpty()) {
            sb.append("## 未参与分析的内容\n\n");
            for (UnanalyzableUnit u : unanalyzable) {
                sb.append("- ").append(u.getUnit()).append("：").append(u.getReason()).append('\n');
            }
            sb.append('\n');
        }

        // 7. 建议
        sb.append("## 处理建议\n\n");
        for (String r : report.getRecommendations()) {
            sb.append(r).append("\n\n");
        }
        return sb.toString().stripTrailing() + "\n";
    }

    private static void row(StringBuilder sb, String name, boolean ok) {
        sb.append("| ").append(name).append(" | ").append(ok ? "完成" : "未完成").append(" |\n");
    }

    private static String cell(String s) {
        if (s == null) return "-";
        return s.replace("|", "\\|").replace("\n", " ");
    }

    private static String nullToDash(String s) {
        return s == null ? "-" : s;
    }

    private static String score(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
    }
}
