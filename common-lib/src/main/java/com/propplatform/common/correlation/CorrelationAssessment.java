package com.propplatform.common.correlation;

import java.util.List;

/**
 * @param penalty  total confidence penalty for the bundle, always ≤ 0 and never
 *                 below the analyzer's floor
 * @param warnings one entry per flagged leg pair
 */
public record CorrelationAssessment(double penalty, List<CorrelationWarning> warnings) {

    public static final CorrelationAssessment NONE = new CorrelationAssessment(0.0, List.of());

    public CorrelationAssessment {
        warnings = List.copyOf(warnings);
    }

    /** Applies the penalty to a naive combined confidence, clamped to [0, 100]. */
    public double applyTo(double naiveConfidence) {
        return Math.max(0.0, Math.min(100.0, naiveConfidence + penalty));
    }
}
