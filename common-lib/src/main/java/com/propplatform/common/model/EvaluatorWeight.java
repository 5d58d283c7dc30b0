package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Long-lived influence of one evaluator in the weighted average.
 *
 * <ul>
 *   <li>{@code weight}             – current weight, kept within [0.1, 5.0] by the calibrator</li>
 *   <li>{@code lastUpdatedPeriod}  – calibration period that last changed the weight (nullable)</li>
 *   <li>{@code sampleCount}        – cumulative number of graded contributions</li>
 *   <li>{@code cumulativeAccuracy} – hit rate across all graded contributions</li>
 * </ul>
 */
public record EvaluatorWeight(
    @JsonProperty("evaluator")          String evaluator,
    @JsonProperty("weight")             double weight,
    @JsonProperty("lastUpdatedPeriod")  String lastUpdatedPeriod,
    @JsonProperty("sampleCount")        long sampleCount,
    @JsonProperty("cumulativeAccuracy") double cumulativeAccuracy,
    @JsonProperty("lastUpdated")        Instant lastUpdated
) {
    public static EvaluatorWeight initial(String evaluator, double weight) {
        return new EvaluatorWeight(evaluator, weight, null, 0L, 0.0, null);
    }
}
