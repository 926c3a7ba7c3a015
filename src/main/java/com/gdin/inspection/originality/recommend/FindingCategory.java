package com.gdin.inspection.originality.recommend;

import java.util.Locale;

public enum FindingCategory {
    AUTHORSHIP("作者身份"),
    INTERNAL_DUPLICATION("内部重复"),
    CROSS_SUBMISSION("跨提交相似");

    private final String label;

    FindingCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 模型输出里的类别名，识别不了返回 null
     */
    public static FindingCategory of(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (FindingCategory c : values()) {
            if (c.name().toLowerCase(Locale.ROOT).equals(v) || c.label.equals(raw.trim())) return c;
        }
        if (v.contains("internal")) return INTERNAL_DUPLICATION;
        if (v.contains("cross") || v.contains("external")) return CROSS_SUBMISSION;
        if (v.contains("author") || v.startsWith("ai")) return AUTHORSHIP;
        return null;
    }
}
