package com.propplatform.common.calibration;

import com.propplatform.common.model.CalibrationSample;
import com.propplatform.common.model.EvaluatorContribution;
import com.propplatform.common.model.Side;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grades each evaluator against realised outcomes.
 *
 * <p>An evaluator is graded only on the propositions it contributed to;
 * abstentions leave no trace in the sample and are therefore never graded.
 */
public final class AccuracyMeasurer {

    private AccuracyMeasurer() {}

    /**
     * @param samples   historical scorings with outcomes
     * @param evaluators evaluators that must appear in the result even without samples
     * @return per-evaluator accuracy keyed by evaluator name, in first-seen order
     */
    public static Map<String, EvaluatorAccuracy> measure(List<CalibrationSample> samples,
                                                         Collection<String> evaluators) {
        Map<String, EvaluatorAccuracy> byEvaluator = new LinkedHashMap<>();
        for (String name : evaluators) {
            byEvaluator.put(name, EvaluatorAccuracy.empty(name));
        }

        for (CalibrationSample sample : samples) {
            Side side = sample.scored().proposition().side();
            boolean hit = sample.outcome().hit();
            for (EvaluatorContribution c : sample.scored().contributions()) {
                double predicted = ProbabilityMapping.predictedProbability(c.score(), side);
                byEvaluator.merge(c.evaluator(),
                    EvaluatorAccuracy.empty(c.evaluator()).plus(predicted, hit),
                    (current, ignored) -> current.plus(predicted, hit));
            }
        }
        return byEvaluator;
    }
}
