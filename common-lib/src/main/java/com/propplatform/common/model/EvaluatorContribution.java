package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One non-abstaining evaluator's part in a scored proposition.
 * {@code score} is OVER-oriented regardless of the proposition's side.
 */
public record EvaluatorContribution(
    @JsonProperty("evaluator") String evaluator,
    @JsonProperty("score")     double score,
    @JsonProperty("weight")    double weight,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("rationale") List<String> rationale
) {
    public EvaluatorContribution {
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    /** Distance from neutral scaled by weight: how hard this evaluator pulled the result. */
    public double pull() {
        return Math.abs(score - 50.0) * weight;
    }
}
