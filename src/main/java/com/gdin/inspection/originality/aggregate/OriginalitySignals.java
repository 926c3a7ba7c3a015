package com.gdin.inspection.originality.aggregate;

/**
 * 三个非原创证据，均在 [0,1]；null 表示该子系统不可用，不参与评分
 *
 * @param internal       内部最高保留对权重
 * @param crossSubmission 跨提交最高相似度
 * @param authorship     单元最高 AI 置信度 / 100
 */
public record OriginalitySignals(Double internal, Double crossSubmission, Double authorship) {

    public OriginalitySignals {
        internal = clamp(internal);
        crossSubmission = clamp(crossSubmission);
        authorship = clamp(authorship);
    }

    public boolean internalAvailable() {
        return internal != null;
    }

    public boolean crossSubmissionAvailable() {
        return crossSubmission != null;
    }

    public boolean authorshipAvailable() {
        return authorship != null;
    }

    private static Double clamp(Double v) {
        if (v == null || v.isNaN()) return null;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
