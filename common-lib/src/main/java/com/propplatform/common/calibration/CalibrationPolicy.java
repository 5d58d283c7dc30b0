package com.propplatform.common.calibration;

/**
 * Bounds and coefficients of the weight delta rule.
 *
 * @param sensitivity      {@code k}: weight change per unit of overconfidence
 * @param minSamples       adjustments with fewer graded samples are skipped
 * @param maxDelta         largest absolute weight change per period
 * @param minWeight        lower weight bound
 * @param maxWeight        upper weight bound
 * @param highAccuracy     accuracy above which a bonus is added
 * @param lowAccuracy      accuracy below which a penalty is subtracted
 * @param accuracyFactor   scale of the accuracy bonus / penalty
 */
public record CalibrationPolicy(
    double sensitivity,
    int minSamples,
    double maxDelta,
    double minWeight,
    double maxWeight,
    double highAccuracy,
    double lowAccuracy,
    double accuracyFactor
) {
    public static final CalibrationPolicy DEFAULT =
        new CalibrationPolicy(3.0, 10, 0.5, 0.1, 5.0, 0.70, 0.50, 2.0);

    public CalibrationPolicy {
        if (minWeight <= 0.0 || minWeight > maxWeight) {
            throw new IllegalArgumentException(
                "Weight bounds invalid: min=" + minWeight + " max=" + maxWeight);
        }
        if (maxDelta < 0.0) {
            throw new IllegalArgumentException("maxDelta must be >= 0, was " + maxDelta);
        }
        if (lowAccuracy > highAccuracy) {
            throw new IllegalArgumentException(
                "Accuracy bands invalid: low=" + lowAccuracy + " high=" + highAccuracy);
        }
    }
}
