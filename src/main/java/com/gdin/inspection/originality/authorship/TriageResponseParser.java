package com.gdin.inspection.originality.authorship;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.originality.util.JsonExtractors;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 初筛输出的宽松解析：先按 JSON，取不到再用正则兜底。任何情况下都不抛异常
 */
public class TriageResponseParser {

    private static final Pattern VERDICT = Pattern.compile(
            "[\"']?quick_verdict[\"']?\\s*[:=]\\s*[\"']?([A-Za-z_\\- ]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEVEL = Pattern.compile(
            "[\"']?confidence_level[\"']?\\s*[:=]\\s*[\"']?([A-Za-z]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE = Pattern.compile(
            "[\"']?initial_confidence[\"']?\\s*[:=]\\s*[\"']?(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    static final double AI_FLOOR = 70.0;
    static final double HUMAN_CEILING = 29.0;

    private final double aiDefault;
    private final double humanDefault;

    public TriageResponseParser(double aiDefault, double humanDefault) {
        this.aiDefault = aiDefault;
        this.humanDefault = humanDefault;
    }

    public TriageOutcome parse(String raw) {
        if (StrUtil.isBlank(raw)) return new TriageOutcome.Unknown(raw);

        String verdict;
        String level;
        Double confidence;
        String reason = null;

        JSONObject json = JsonExtractors.parseFirstJsonObject(raw);
        if (json != null && json.containsKey("quick_verdict")) {
            verdict = json.getString("quick_verdict");
            level = json.getString("confidence_level");
            confidence = number(json.get("initial_confidence"));
            reason = json.getString("reason");
        } else {
            verdict = group(VERDICT, raw);
            level = group(LEVEL, raw);
            String c = group(CONFIDENCE, raw);
            confidence = c == null ? null : Double.valueOf(c);
        }

        return classify(verdict, level, confidence, reason, raw);
    }

    private TriageOutcome classify(String verdict, String level, Double confidence, String reason, String raw) {
        if (verdict == null) return new TriageOutcome.Unknown(raw);
        String v = verdict.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        boolean high = level != null && "high".equalsIgnoreCase(level.trim());

        switch (v) {
            case "ai_generated", "ai", "obviously_ai" -> {
                if (!high) return new TriageOutcome.Uncertain(confidence == null ? 50.0 : clamp(confidence, 0, 100));
                double score = confidence == null ? aiDefault : clamp(confidence, AI_FLOOR, 100.0);
                return new TriageOutcome.ObviouslyAi(score, reason);
            }
            case "human_written", "human", "obviously_human" -> {
                if (!high) return new TriageOutcome.Uncertain(confidence == null ? 50.0 : clamp(confidence, 0, 100));
                double score = confidence == null ? humanDefault : clamp(confidence, 0.0, HUMAN_CEILING);
                return new TriageOutcome.ObviouslyHuman(score, reason);
            }
            case "uncertain", "unsure", "mixed" -> {
                return new TriageOutcome.Uncertain(confidence == null ? 50.0 : clamp(confidence, 0, 100));
            }
            default -> {
                return new TriageOutcome.Unknown(raw);
            }
        }
    }

    private static Double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.valueOf(s.replace("%", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String group(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).trim() : null;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
