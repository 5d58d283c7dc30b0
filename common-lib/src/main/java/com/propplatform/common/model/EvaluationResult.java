package com.propplatform.common.model;

import java.util.List;

/**
 * Outcome of one evaluator on one proposition: either a score or an explicit
 * abstention. Abstentions are excluded from aggregation by construction, so a
 * missing input can never pull a strong signal toward neutral.
 */
public sealed interface EvaluationResult permits EvaluationResult.Scored, EvaluationResult.Abstain {

    String evaluator();

    /**
     * @param score     OVER-oriented score in [0, 100]
     * @param direction lean implied by {@code score}
     * @param rationale human-readable reasons, most important first
     */
    record Scored(String evaluator, double score, Direction direction, List<String> rationale)
            implements EvaluationResult {
        public Scored {
            if (evaluator == null || evaluator.isBlank()) {
                throw new IllegalArgumentException("evaluator name required");
            }
            if (!Double.isFinite(score) || score < 0.0 || score > 100.0) {
                throw new IllegalArgumentException(
                    "Score of " + evaluator + " must be within [0, 100], was " + score);
            }
            if (direction == null) {
                throw new IllegalArgumentException("direction required for " + evaluator);
            }
            rationale = rationale == null ? List.of() : List.copyOf(rationale);
        }
    }

    record Abstain(String evaluator, String reason) implements EvaluationResult {}

    /** Clamps finite out-of-range scores; NaN and infinities are still rejected. */
    static Scored scored(String evaluator, double score, List<String> rationale) {
        double clamped = Math.max(0.0, Math.min(100.0, score));
        return new Scored(evaluator, clamped, Direction.fromScore(clamped), rationale);
    }

    static Abstain abstain(String evaluator, String reason) {
        return new Abstain(evaluator, reason);
    }
}
