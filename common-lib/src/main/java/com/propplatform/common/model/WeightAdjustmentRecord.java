package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Append-only audit entry for one evaluator in one calibration period.
 * Written for applied and skipped adjustments alike; never updated or deleted.
 */
public record WeightAdjustmentRecord(
    @JsonProperty("evaluator")      String evaluator,
    @JsonProperty("oldWeight")      double oldWeight,
    @JsonProperty("newWeight")      double newWeight,
    @JsonProperty("action")         AdjustmentAction action,
    @JsonProperty("reason")         String reason,
    @JsonProperty("period")         String period,
    @JsonProperty("accuracy")       double accuracy,
    @JsonProperty("overconfidence") double overconfidence,
    @JsonProperty("sampleSize")     int sampleSize,
    @JsonProperty("timestamp")      Instant timestamp
) {
    public double delta() {
        return newWeight - oldWeight;
    }
}
