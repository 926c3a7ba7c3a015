package com.gdin.inspection.originality.authorship;

/**
 * 初筛结果。Unknown 表示模型给出了无法识别的结论，与 Uncertain 一样进入深度分析
 */
public sealed interface TriageOutcome
        permits TriageOutcome.ObviouslyAi, TriageOutcome.ObviouslyHuman,
        TriageOutcome.Uncertain, TriageOutcome.Unknown {

    /** 初筛能否直接给出结论 */
    default boolean isConclusive() {
        return this instanceof ObviouslyAi || this instanceof ObviouslyHuman;
    }

    /** 置信度已夹到 [70,100] */
    record ObviouslyAi(double score, String reason) implements TriageOutcome {
    }

    /** 置信度已夹到 [0,29] */
    record ObviouslyHuman(double score, String reason) implements TriageOutcome {
    }

    record Uncertain(double score) implements TriageOutcome {
    }

    record Unknown(String raw) implements TriageOutcome {
    }
}
