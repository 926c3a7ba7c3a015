package com.gdin.inspection.originality.authorship;

import java.util.Map;

/**
 * 深度分析解析结果。scores 只包含模型实际给出的维度
 *
 * @param scores        维度 → 0..100
 * @param evidence      维度 → 证据描述
 * @param toolSignature 疑似工具，未知时为 null
 */
public record DeepAnalysis(Map<AuthorshipDimension, Double> scores,
                           Map<AuthorshipDimension, String> evidence,
                           String toolSignature) {

    public DeepAnalysis {
        scores = Map.copyOf(scores);
        evidence = Map.copyOf(evidence);
    }

    public boolean isComplete() {
        return scores.size() == AuthorshipDimension.values().length;
    }
}
