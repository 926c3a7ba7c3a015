package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthorshipVerdict {

    @JsonProperty("unit")
    String unit;

    @JsonProperty("confidence")
    double confidence;

    /** 由 confidence 推导，构建时忽略外部传入值 */
    @JsonProperty("category")
    AuthorshipCategory category;

    @JsonProperty("rationale")
    List<RationaleEntry> rationale;

    @JsonProperty("resolved_by")
    ResolutionStage resolvedBy;

    @JsonProperty("degraded_confidence")
    boolean degradedConfidence;

    /** 深度分析给出的工具特征（chatgpt / copilot ...），可为空 */
    @JsonProperty("tool_signature")
    String toolSignature;

    public static class AuthorshipVerdictBuilder {
        public AuthorshipVerdict build() {
            double clamped = Math.max(0.0, Math.min(100.0, confidence));
            List<RationaleEntry> entries = rationale == null ? List.of() : List.copyOf(rationale);
            return new AuthorshipVerdict(unit, clamped, AuthorshipCategory.fromConfidence(clamped),
                    entries, resolvedBy, degradedConfidence, toolSignature);
        }
    }
}
