package com.propplatform.common.calibration;

import com.propplatform.common.model.AdjustmentAction;

import java.util.Locale;

/**
 * Bounded delta rule that moves an evaluator's weight toward its observed
 * reliability.
 *
 * <h3>Formula</h3>
 * <pre>
 *   Δ  = −overconfidence × k
 *   Δ += (accuracy − 0.70) × 2.0   if accuracy &gt; 0.70
 *   Δ −= (0.50 − accuracy) × 2.0   if accuracy &lt; 0.50
 *   Δ  = clamp(Δ, −0.5, +0.5)
 *   newWeight = clamp(oldWeight + Δ, 0.1, 5.0)
 * </pre>
 * Fewer than {@code minSamples} graded samples → skipped with reason
 * {@value #INSUFFICIENT_DATA}, weight unchanged.
 *
 * <p>Coefficients and bounds come from {@link CalibrationPolicy}.
 * Pure static utility: no Spring dependencies, no state.
 */
public final class WeightAdjustmentCalculator {

    public static final String INSUFFICIENT_DATA = "insufficient data";

    private static final double CALIBRATION_BAND = 0.05;

    private WeightAdjustmentCalculator() {}

    public static WeightAdjustment adjust(double oldWeight, EvaluatorAccuracy stats, CalibrationPolicy policy) {
        double accuracy       = stats.accuracy();
        double overconfidence = stats.overconfidence();

        if (stats.sampleSize() < policy.minSamples()) {
            return new WeightAdjustment(stats.evaluator(), oldWeight, oldWeight, AdjustmentAction.SKIPPED,
                                        INSUFFICIENT_DATA, accuracy, overconfidence, stats.sampleSize());
        }

        double delta = delta(accuracy, overconfidence, policy);
        double newWeight = clamp(oldWeight + delta, policy.minWeight(), policy.maxWeight());

        return new WeightAdjustment(stats.evaluator(), oldWeight, newWeight, AdjustmentAction.APPLIED,
                                    reason(accuracy, overconfidence, policy),
                                    accuracy, overconfidence, stats.sampleSize());
    }

    /** The bounded Δ, before the weight clamp. */
    public static double delta(double accuracy, double overconfidence, CalibrationPolicy policy) {
        double delta = -overconfidence * policy.sensitivity();
        if (accuracy > policy.highAccuracy()) {
            delta += (accuracy - policy.highAccuracy()) * policy.accuracyFactor();
        }
        if (accuracy < policy.lowAccuracy()) {
            delta -= (policy.lowAccuracy() - accuracy) * policy.accuracyFactor();
        }
        return clamp(delta, -policy.maxDelta(), policy.maxDelta());
    }

    static String reason(double accuracy, double overconfidence, CalibrationPolicy policy) {
        if (overconfidence > CALIBRATION_BAND) {
            return String.format(Locale.ROOT, "overconfident (%+.1f%%)", overconfidence * 100);
        }
        if (overconfidence < -CALIBRATION_BAND) {
            return String.format(Locale.ROOT, "underconfident (%+.1f%%)", overconfidence * 100);
        }
        if (accuracy > policy.highAccuracy()) {
            return String.format(Locale.ROOT, "high accuracy (%.1f%%)", accuracy * 100);
        }
        if (accuracy < policy.lowAccuracy()) {
            return String.format(Locale.ROOT, "low accuracy (%.1f%%)", accuracy * 100);
        }
        return "minor calibration adjustment";
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
