package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.propplatform.common.correlation.CorrelationWarning;

import java.util.List;

/**
 * A combination of 2–5 scored propositions wagered together.
 *
 * <p>{@code naiveConfidence} is the arithmetic mean of the legs' confidences;
 * {@code adjustedConfidence} adds the (non-positive) correlation penalty and is
 * clamped to [0, 100].
 */
public record Bundle(
    @JsonProperty("legs")               List<ScoredProposition> legs,
    @JsonProperty("naiveConfidence")    double naiveConfidence,
    @JsonProperty("correlationPenalty") double correlationPenalty,
    @JsonProperty("adjustedConfidence") double adjustedConfidence,
    @JsonProperty("warnings")           List<CorrelationWarning> warnings,
    @JsonProperty("riskLevel")          BundleRisk riskLevel,
    @JsonProperty("expectedValue")      double expectedValue,
    @JsonProperty("recommendedUnits")   double recommendedUnits
) {
    public Bundle {
        legs     = List.copyOf(legs);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int size() {
        return legs.size();
    }
}
