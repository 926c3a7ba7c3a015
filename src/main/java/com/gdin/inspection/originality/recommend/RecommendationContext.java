package com.gdin.inspection.originality.recommend;

import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.RiskLevel;
import com.gdin.inspection.originality.models.SubsystemAvailability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 生成建议所需的全部输入，来自合并后的评分结果
 */
@Value
@Builder
public class RecommendationContext {

    double originalityScore;

    RiskLevel riskLevel;

    /** 提交以代码为主 */
    boolean codeSubmission;

    @Singular
    List<InternalPairFinding> internalPairs;

    @Singular
    List<CrossSubmissionHit> crossSubmissionHits;

    @Singular
    List<AuthorshipVerdict> authorshipVerdicts;

    SubsystemAvailability availability;
}
