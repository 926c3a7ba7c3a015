package com.gdin.inspection.originality.aggregate;

import com.gdin.inspection.originality.models.RiskLevel;

/**
 * @param originalityScore 0..100
 * @param duplicationScore 只考虑内部与跨提交重复，0..100
 * @param authorshipScore  只考虑作者身份，0..100
 */
public record AggregatedScore(double originalityScore,
                              double duplicationScore,
                              double authorshipScore,
                              RiskLevel riskLevel) {
}
