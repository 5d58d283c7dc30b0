package com.propplatform.common.calibration;

import com.propplatform.common.model.Side;

/**
 * Maps an evaluator's OVER-oriented score to the probability it implied for the
 * wagered side.
 *
 * <pre>
 *   OVER  proposition: p = score / 100
 *   UNDER proposition: p = (100 − score) / 100
 * </pre>
 *
 * The mapping is monotonic in the score for each side and mirrors the
 * {@link com.propplatform.common.scoring.SideTransform} used for confidences,
 * so an UNDER leg is graded exactly like the OVER leg of the complementary line.
 */
public final class ProbabilityMapping {

    private ProbabilityMapping() {}

    public static double predictedProbability(double overOrientedScore, Side side) {
        double clamped = Math.max(0.0, Math.min(100.0, overOrientedScore));
        return side == Side.UNDER ? (100.0 - clamped) / 100.0 : clamped / 100.0;
    }
}
