package com.propplatform.common.model;

/**
 * Lean of a single evaluator score. Scores are OVER-oriented:
 * above 50 leans OVER, below 50 leans UNDER, exactly 50 is NEUTRAL.
 */
public enum Direction {
    OVER,
    UNDER,
    NEUTRAL;

    public static Direction fromScore(double score) {
        if (score > 50.0) return OVER;
        if (score < 50.0) return UNDER;
        return NEUTRAL;
    }
}
