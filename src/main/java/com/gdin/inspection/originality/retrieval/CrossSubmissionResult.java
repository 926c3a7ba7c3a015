package com.gdin.inspection.originality.retrieval;

import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.SimilarityMatch;
import lombok.Value;

import java.util.List;

@Value
public class CrossSubmissionResult {

    /** false 表示检索未完成，信号不参与评分 */
    boolean checked;

    /** 按相似度降序 */
    List<CrossSubmissionHit> hits;

    List<SimilarityMatch> matches;

    /** 检索中出现过的不同历史提交数 */
    int sourcesChecked;

    String unavailableReason;

    public double maxSimilarity() {
        return hits.stream().mapToDouble(CrossSubmissionHit::getSimilarity).max().orElse(0.0);
    }

    public static CrossSubmissionResult unavailable(String reason) {
        return new CrossSubmissionResult(false, List.of(), List.of(), 0, reason);
    }
}
