package com.gdin.inspection.originality.util;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONReader;

/**
 * 从模型的自由文本输出里取出第一个 JSON 对象
 */
public final class JsonExtractors {
    private JsonExtractors() {}

    public static String extractFirstJsonObject(String text) {
        if (text == null) return null;
        String t = stripThink(text).trim();

        // ```json ... ```
        String fenced = extractJsonFromCodeFence(t);
        if (StrUtil.isNotBlank(fenced)) {
            String obj = extractByBraceCounting(fenced);
            if (StrUtil.isNotBlank(obj)) return obj.trim();
        }

        String obj = extractByBraceCounting(t);
        if (StrUtil.isNotBlank(obj)) return obj.trim();

        int first = t.indexOf('{');
        int last = t.lastIndexOf('}');
        if (first >= 0 && last > first) return t.substring(first, last + 1).trim();

        return null;
    }

    /**
     * 宽松解析，取不到或解析失败返回 null
     */
    public static JSONObject parseFirstJsonObject(String text) {
        String json = extractFirstJsonObject(text);
        if (StrUtil.isBlank(json)) return null;
        try {
            return JSON.parseObject(json, JSONReader.Feature.AllowUnQuotedFieldNames);
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * 思考模型会把推理过程放在 think 标签里
     */
    static String stripThink(String t) {
        int end = t.lastIndexOf("</think>");
        return end >= 0 ? t.substring(end + "</think>".length()) : t;
    }

    private static String extractJsonFromCodeFence(String t) {
        int start = t.indexOf("```json");
        if (start < 0) start = t.indexOf("```JSON");
        if (start < 0) return null;
        int bodyStart = t.indexOf('\n', start);
        if (bodyStart < 0) return null;
        int end = t.indexOf("```", bodyStart + 1);
        if (end < 0) return null;
        return t.substring(bodyStart + 1, end).trim();
    }

    private static String extractByBraceCounting(String t) {
        int first = t.indexOf('{');
        if (first < 0) return null;

        int depth = 0;
        boolean inString = false;
        char prev = 0;

        for (int i = first; i < t.length(); i++) {
            char c = t.charAt(i);

            if (c == '"' && prev != '\\') inString = !inString;

            if (!inString) {
                if (c == '{') depth++;
                else if (c == '}') depth--;
                if (depth == 0) return t.substring(first, i + 1);
            }
            prev = c;
        }
        return null;
    }
}
