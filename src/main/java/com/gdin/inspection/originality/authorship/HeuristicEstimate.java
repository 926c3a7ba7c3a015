package com.gdin.inspection.originality.authorship;

/**
 * 启发式估计，各信号都已归一到 0..1，越大越像生成内容
 *
 * @param confidence 0..100
 */
public record HeuristicEstimate(double confidence,
                                double commentSignal,
                                double namingSignal,
                                double uniformitySignal) {

    /** 深度分析缺失维度时的补位分数 */
    public double dimensionScore(AuthorshipDimension dimension) {
        return switch (dimension) {
            case DOCUMENTATION_STYLE -> commentSignal * 100.0;
            case NAMING -> namingSignal * 100.0;
            case STRUCTURE_FORMATTING -> uniformitySignal * 100.0;
            default -> confidence;
        };
    }
}
