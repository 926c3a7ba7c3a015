package com.gdin.inspection.originality.aggregate;

import com.gdin.inspection.originality.internal.InternalComparisonResult;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.RiskLevel;
import com.gdin.inspection.originality.retrieval.CrossSubmissionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * 把各子系统的证据按独立概率合并：penalty = 1 − Π(1 − s)，
 * 原创性分数 = 100 × (1 − penalty)。不可用的子系统不产生惩罚。
 */
@Slf4j
@Component
public class OriginalityAggregator {

    public AggregatedScore aggregate(OriginalitySignals signals) {
        double keepInternal = keep(signals.internal());
        double keepCross = keep(signals.crossSubmission());
        double keepAuthorship = keep(signals.authorship());

        double originality = 100.0 * keepInternal * keepCross * keepAuthorship;
        double duplication = 100.0 * keepInternal * keepCross;
        double authorship = 100.0 * keepAuthorship;

        AggregatedScore score = new AggregatedScore(clamp(originality), clamp(duplication), clamp(authorship),
                RiskLevel.fromScore(clamp(originality)));
        log.debug("评分合并：signals={}, score={}", signals, score);
        return score;
    }

    /**
     * 从各分支结果取信号。branch 为 null 表示超时或未执行
     *
     * @param countedVerdicts 截止时间前完成的单元判定，超时补位的判定不在其中
     */
    public static OriginalitySignals signals(InternalComparisonResult internal,
                                             CrossSubmissionResult crossSubmission,
                                             Collection<AuthorshipVerdict> countedVerdicts) {
        Double internalSignal = internal == null ? null : internal.maxWeight();
        Double crossSignal = crossSubmission == null || !crossSubmission.isChecked()
                ? null : crossSubmission.maxSimilarity();
        Double authorshipSignal = countedVerdicts == null || countedVerdicts.isEmpty()
                ? null
                : countedVerdicts.stream().mapToDouble(AuthorshipVerdict::getConfidence).max().orElse(0.0) / 100.0;
        return new OriginalitySignals(internalSignal, crossSignal, authorshipSignal);
    }

    private static double keep(Double signal) {
        return signal == null ? 1.0 : 1.0 - signal;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
