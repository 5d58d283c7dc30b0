package com.propplatform.common.calibration;

/**
 * Graded performance of one evaluator within a calibration period.
 *
 * @param sampleSize       propositions the evaluator contributed to that have an outcome
 * @param hits             how many of those propositions hit
 * @param sumPredicted     sum of the evaluator's predicted probabilities for the wagered side
 */
public record EvaluatorAccuracy(String evaluator, int sampleSize, int hits, double sumPredicted) {

    public static EvaluatorAccuracy empty(String evaluator) {
        return new EvaluatorAccuracy(evaluator, 0, 0, 0.0);
    }

    public EvaluatorAccuracy plus(double predicted, boolean hit) {
        return new EvaluatorAccuracy(evaluator, sampleSize + 1, hits + (hit ? 1 : 0), sumPredicted + predicted);
    }

    public double accuracy() {
        return sampleSize == 0 ? 0.0 : (double) hits / sampleSize;
    }

    public double meanPredicted() {
        return sampleSize == 0 ? 0.0 : sumPredicted / sampleSize;
    }

    /** Positive when the evaluator predicted hits more often than they happened. */
    public double overconfidence() {
        return sampleSize == 0 ? 0.0 : meanPredicted() - accuracy();
    }
}
