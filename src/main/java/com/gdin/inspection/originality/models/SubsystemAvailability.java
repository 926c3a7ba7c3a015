package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 各子系统是否参与了本次评分，false 表示被跳过或超时
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class SubsystemAvailability {

    @JsonProperty("internal_comparison_completed")
    boolean internalComparisonCompleted;

    @JsonProperty("cross_submission_checked")
    boolean crossSubmissionChecked;

    @JsonProperty("authorship_classified")
    boolean authorshipClassified;

    /** 至少一个单元走了启发式兜底 */
    @JsonProperty("authorship_degraded")
    boolean authorshipDegraded;

    @JsonProperty("recommendations_elaborated")
    boolean recommendationsElaborated;
}
