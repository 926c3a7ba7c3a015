package com.gdin.inspection.originality.authorship;

import com.gdin.inspection.originality.models.ContentUnit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 不依赖模型的确定性估计：注释密度、标识符熵、行长离散度。
 * 代码按 0.4 / 0.3 / 0.3 加权，非代码没有注释信号，按 0.5 / 0.5。
 */
@Component
public class HeuristicAuthorshipEstimator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final Pattern COMMENT_LINE = Pattern.compile(
            "^\\s*(//|#(?!include|define|if|ifdef|ifndef|endif|pragma)|/\\*|\\*|\"\"\"|''')");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\S.*?\\s(//|#)\\s");

    /** 注释行占比达到该值视为满分 */
    static final double COMMENT_SATURATION = 0.35;
    /** 平均标识符长度达到该值视为满分 */
    static final double NAME_LENGTH_SATURATION = 10.0;

    public HeuristicEstimate estimate(ContentUnit unit) {
        String text = unit.getRawText() == null ? "" : unit.getRawText();
        List<String> lines = nonBlankLines(text);
        double uniformity = uniformity(lines);

        if (unit.isCode()) {
            double comment = Math.min(1.0, commentDensity(lines) / COMMENT_SATURATION);
            double naming = naming(tokens(IDENTIFIER, text));
            double confidence = 100.0 * (0.4 * comment + 0.3 * naming + 0.3 * uniformity);
            return new HeuristicEstimate(confidence, comment, naming, uniformity);
        }

        double naming = naming(tokens(WORD, text));
        double confidence = 100.0 * (0.5 * naming + 0.5 * uniformity);
        return new HeuristicEstimate(confidence, 0.0, naming, uniformity);
    }

    static double commentDensity(List<String> lines) {
        if (lines.isEmpty()) return 0.0;
        int comments = 0;
        for (String line : lines) {
            if (COMMENT_LINE.matcher(line).find() || TRAILING_COMMENT.matcher(line).find()) comments++;
        }
        return (double) comments / lines.size();
    }

    /**
     * 标识符分布的归一化香农熵乘以平均长度系数
     */
    static double naming(List<String> names) {
        if (names.size() < 2) return 0.0;
        Map<String, Integer> counts = new HashMap<>();
        long totalLength = 0;
        for (String name : names) {
            counts.merge(name, 1, Integer::sum);
            totalLength += name.length();
        }
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = (double) count / names.size();
            entropy -= p * Math.log(p);
        }
        double normalized = entropy / Math.log(names.size());
        double lengthFactor = Math.min(1.0, (double) totalLength / names.size() / NAME_LENGTH_SATURATION);
        return Math.max(0.0, Math.min(1.0, normalized * lengthFactor));
    }

    /**
     * 1 − 行长变异系数，行长越整齐越接近 1
     */
    static double uniformity(List<String> lines) {
        if (lines.size() < 2) return 0.0;
        double sum = 0.0;
        for (String line : lines) sum += line.strip().length();
        double mean = sum / lines.size();
        if (mean == 0.0) return 0.0;
        double variance = 0.0;
        for (String line : lines) {
            double d = line.strip().length() - mean;
            variance += d * d;
        }
        double cv = Math.sqrt(variance / lines.size()) / mean;
        return Math.max(0.0, 1.0 - Math.min(1.0, cv));
    }

    private static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) lines.add(line);
        }
        return lines;
    }

    private static List<String> tokens(Pattern pattern, String text) {
        List<String> out = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }
}
