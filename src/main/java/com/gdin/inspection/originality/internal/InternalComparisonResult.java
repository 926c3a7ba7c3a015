package com.gdin.inspection.originality.internal;

import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.SimilarityMatch;
import lombok.Value;

import java.util.List;

@Value
public class InternalComparisonResult {

    /** 按 weight 降序，相同 weight 按 (i, j) 升序 */
    List<InternalPairFinding> findings;

    List<SimilarityMatch> matches;

    /** 最高保留权重，没有保留对时为 0 */
    public double maxWeight() {
        return findings.stream().mapToDouble(InternalPairFinding::getWeight).max().orElse(0.0);
    }

    public static InternalComparisonResult empty() {
        return new InternalComparisonResult(List.of(), List.of());
    }
}
