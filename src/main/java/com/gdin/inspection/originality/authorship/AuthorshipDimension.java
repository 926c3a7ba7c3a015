package com.gdin.inspection.originality.authorship;

import java.util.Locale;

/**
 * 深度分析的六个维度，权重合计 100
 */
public enum AuthorshipDimension {

    DOCUMENTATION_STYLE("documentation_style", 25),
    STRUCTURE_FORMATTING("structure_formatting", 20),
    NAMING("naming_identifiers", 20),
    ERROR_HANDLING("error_handling", 15),
    COMPLEXITY("complexity", 10),
    PERSONAL_STYLE("personal_style", 10);

    private final String key;
    private final int weight;

    AuthorshipDimension(String key, int weight) {
        this.key = key;
        this.weight = weight;
    }

    /** 模型输出 JSON 里的字段名 */
    public String getKey() {
        return key;
    }

    public int getWeight() {
        return weight;
    }

    public static AuthorshipDimension ofKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (AuthorshipDimension d : values()) {
            if (d.key.equals(k) || d.name().toLowerCase(Locale.ROOT).equals(k)) return d;
        }
        return null;
    }
}
