package com.gdin.inspection.originality.recommend;

import java.util.List;

/**
 * @param elaborated true 表示由文本生成协作方润色，false 为模板兜底
 */
public record RecommendationResult(List<String> recommendations, boolean elaborated) {

    public RecommendationResult {
        recommendations = List.copyOf(recommendations);
    }
}
