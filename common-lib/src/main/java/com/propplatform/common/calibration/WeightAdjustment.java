package com.propplatform.common.calibration;

import com.propplatform.common.model.AdjustmentAction;
import com.propplatform.common.model.WeightAdjustmentRecord;

import java.time.Instant;

/** Decision of {@link WeightAdjustmentCalculator} for one evaluator, before it is persisted. */
public record WeightAdjustment(
    String evaluator,
    double oldWeight,
    double newWeight,
    AdjustmentAction action,
    String reason,
    double accuracy,
    double overconfidence,
    int sampleSize
) {
    public boolean applied() {
        return action == AdjustmentAction.APPLIED;
    }

    public WeightAdjustmentRecord toRecord(String period, Instant timestamp) {
        return new WeightAdjustmentRecord(evaluator, oldWeight, newWeight, action, reason,
                                          period, accuracy, overconfidence, sampleSize, timestamp);
    }
}
