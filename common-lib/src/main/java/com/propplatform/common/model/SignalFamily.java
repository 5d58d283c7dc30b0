package com.propplatform.common.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of signal families, one per evaluator. Carries the evaluator's
 * registry name and its default weight, used until the calibrator has stored a
 * weight for it.
 */
public enum SignalFamily {
    EFFICIENCY ("Efficiency", 2.5),
    MATCHUP    ("Matchup",    2.0),
    USAGE      ("Usage",      1.8),
    HEALTH     ("Health",     1.5),
    TREND      ("Trend",      1.2),
    GAME_SCRIPT("GameScript", 1.0),
    VARIANCE   ("Variance",   0.8),
    ENVIRONMENT("Weather",    0.5),
    HIT_RATE   ("HitRate",    2.0);

    /** Weight for evaluators that belong to no known family. */
    public static final double FALLBACK_WEIGHT = 1.0;

    private static final Map<String, SignalFamily> BY_EVALUATOR = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(SignalFamily::evaluatorName, Function.identity()));

    private final String evaluatorName;
    private final double defaultWeight;

    SignalFamily(String evaluatorName, double defaultWeight) {
        this.evaluatorName = evaluatorName;
        this.defaultWeight = defaultWeight;
    }

    public String evaluatorName() { return evaluatorName; }
    public double defaultWeight() { return defaultWeight; }

    /**
     * Resolves an evaluator name to its family.
     * Returns null for unrecognised evaluators.
     */
    public static SignalFamily fromEvaluatorName(String evaluatorName) {
        return BY_EVALUATOR.get(evaluatorName);
    }

    public static double defaultWeightOf(String evaluatorName) {
        SignalFamily family = fromEvaluatorName(evaluatorName);
        return family == null ? FALLBACK_WEIGHT : family.defaultWeight();
    }
}
