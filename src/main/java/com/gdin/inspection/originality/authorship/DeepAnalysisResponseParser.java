package com.gdin.inspection.originality.authorship;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.originality.exception.MalformedResponseException;
import com.gdin.inspection.originality.util.JsonExtractors;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 解析深度分析输出。兼容两种写法：
 * dimensions: {key: {score, evidence}} 与 confidence_breakdown: {key: number}
 */
public final class DeepAnalysisResponseParser {

    private DeepAnalysisResponseParser() {}

    /**
     * @throws MalformedResponseException 没有 JSON 或一个维度都没有
     */
    public static DeepAnalysis parse(String raw) {
        JSONObject json = JsonExtractors.parseFirstJsonObject(raw);
        if (json == null) {
            throw new MalformedResponseException("deep analysis output contains no JSON object");
        }

        Map<AuthorshipDimension, Double> scores = new EnumMap<>(AuthorshipDimension.class);
        Map<AuthorshipDimension, String> evidence = new EnumMap<>(AuthorshipDimension.class);

        JSONObject dimensions = object(json, "dimensions");
        if (dimensions == null) dimensions = object(json, "confidence_breakdown");
        if (dimensions != null) {
            for (Map.Entry<String, Object> entry : dimensions.entrySet()) {
                AuthorshipDimension dimension = AuthorshipDimension.ofKey(entry.getKey());
                if (dimension == null) continue;
                Object value = entry.getValue();
                Double score = null;
                if (value instanceof JSONObject obj) {
                    score = number(obj.get("score"));
                    String ev = obj.getString("evidence");
                    if (StrUtil.isNotBlank(ev)) evidence.put(dimension, ev.trim());
                } else {
                    score = number(value);
                }
                if (score != null) scores.put(dimension, Math.max(0.0, Math.min(100.0, score)));
            }
        }

        JSONObject evidenceObj = object(json, "evidence");
        if (evidenceObj != null) {
            for (Map.Entry<String, Object> entry : evidenceObj.entrySet()) {
                AuthorshipDimension dimension = AuthorshipDimension.ofKey(entry.getKey());
                if (dimension != null && entry.getValue() != null) {
                    evidence.putIfAbsent(dimension, String.valueOf(entry.getValue()).trim());
                }
            }
        }

        if (scores.isEmpty()) {
            throw new MalformedResponseException("deep analysis output has no recognizable dimension scores");
        }

        String tool = json.getString("ai_tool_signature");
        if (tool != null) {
            tool = tool.trim().toLowerCase(Locale.ROOT);
            if (tool.isEmpty() || "unknown".equals(tool) || "none".equals(tool)) tool = null;
        }
        return new DeepAnalysis(scores, evidence, tool);
    }

    private static JSONObject object(JSONObject json, String key) {
        return json.get(key) instanceof JSONObject obj ? obj : null;
    }

    private static Double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s && StrUtil.isNotBlank(s)) {
            try {
                return Double.valueOf(s.replace("%", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
