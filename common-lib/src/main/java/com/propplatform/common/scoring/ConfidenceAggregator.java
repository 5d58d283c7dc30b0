package com.propplatform.common.scoring;

import com.propplatform.common.model.DriverShare;
import com.propplatform.common.model.EvaluatorContribution;
import com.propplatform.common.model.Side;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Stateless calculator that folds contributing evaluator scores into one
 * confidence.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   confidence = round(clamp(Σ(score_i × weight_i) / Σ(weight_i), 0, 100))
 * </pre>
 * Both sums run over contributing (non-abstaining) evaluators only. With no
 * contributors the result is the neutral {@value AggregateConfidence#NEUTRAL}
 * flagged as no-signal.
 *
 * <h3>Drivers</h3>
 * Evaluators are ranked by {@code |score − 50| × weight}; the top
 * {@value #MAX_DRIVERS} with a non-zero pull are kept, each with its percentage
 * of the total pull of all contributors.
 *
 * <p>Pure static utility: no Spring dependencies, no state.
 */
public final class ConfidenceAggregator {

    public static final int MAX_DRIVERS = 2;

    private static final Comparator<EvaluatorContribution> BY_PULL_DESC =
        Comparator.comparingDouble(EvaluatorContribution::pull).reversed()
                  .thenComparing(EvaluatorContribution::evaluator);

    private ConfidenceAggregator() {}

    public static AggregateConfidence aggregate(List<EvaluatorContribution> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            return AggregateConfidence.none();
        }

        double totalWeight = 0.0;
        double weightedSum = 0.0;
        for (EvaluatorContribution c : contributions) {
            totalWeight += c.weight();
            weightedSum += c.score() * c.weight();
        }
        if (totalWeight <= 0.0) {
            return AggregateConfidence.none();
        }

        double average   = Math.max(0.0, Math.min(100.0, weightedSum / totalWeight));
        int confidence   = (int) Math.round(average);
        return new AggregateConfidence(confidence, false, rankDrivers(contributions));
    }

    static List<DriverShare> rankDrivers(List<EvaluatorContribution> contributions) {
        double totalPull = contributions.stream().mapToDouble(EvaluatorContribution::pull).sum();
        if (totalPull <= 0.0) {
            return List.of();
        }
        return contributions.stream()
            .filter(c -> c.pull() > 0.0)
            .sorted(BY_PULL_DESC)
            .limit(MAX_DRIVERS)
            .map(c -> new DriverShare(c.evaluator(), c.pull() / totalPull * 100.0))
            .collect(Collectors.toList());
    }

    /**
     * Human-readable summary of the edge for {@code side}.
     *
     * <pre>
     *   |confidence − 50| ≥ 25 → STRONG
     *   |confidence − 50| ≥ 15 → GOOD
     *   |confidence − 50| ≥  8 → MODERATE
     *   otherwise              → SLIGHT
     * </pre>
     */
    public static String explain(int sideConfidence, Side side, boolean noSignal,
                                 List<EvaluatorContribution> contributions, List<DriverShare> drivers) {
        if (noSignal) {
            return "No signal - every evaluator abstained.";
        }
        if (drivers.isEmpty()) {
            return "Neutral - no clear edge identified.";
        }

        double orientation = side == Side.OVER ? 1.0 : -1.0;
        List<String> parts = new ArrayList<>();
        for (DriverShare driver : drivers) {
            contributions.stream()
                .filter(c -> c.evaluator().equals(driver.evaluator()))
                .findFirst()
                .ifPresent(c -> parts.add(String.format(Locale.ROOT, "%s (%+.1f)",
                    c.evaluator(), (c.score() - 50.0) * c.weight() * orientation)));
        }

        int distance = Math.abs(sideConfidence - 50);
        String strength;
        if (distance >= 25)      strength = "STRONG";
        else if (distance >= 15) strength = "GOOD";
        else if (distance >= 8)  strength = "MODERATE";
        else                     strength = "SLIGHT";

        String lean = sideConfidence >= 50 ? side.name() : side.opposite().name();
        return strength + " " + lean + " edge primarily driven by: " + String.join(", ", parts);
    }
}
