package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InternalPairFinding {

    @JsonProperty("first_unit")
    String firstUnit;

    @JsonProperty("second_unit")
    String secondUnit;

    @JsonProperty("lexical_score")
    double lexicalScore;

    @JsonProperty("stripped_lexical_score")
    double strippedLexicalScore;

    /** structural_used=false 时无意义 */
    @JsonProperty("structural_score")
    double structuralScore;

    @JsonProperty("structural_used")
    boolean structuralUsed;

    @JsonProperty("parse_failed")
    boolean parseFailed;

    @JsonProperty("weight")
    double weight;

    @JsonProperty("flagged")
    boolean flagged;
}
