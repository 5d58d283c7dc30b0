package com.propplatform.common.correlation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symmetric lookup of how strongly two evaluators' signals overlap, on a scale of
 * roughly 0.5 (nearly independent) to 1.5 (the same weakness measured twice).
 *
 * <p>Kept as data so it can be recalibrated from observed results without a
 * redeploy; see {@code correlation.strengths} in configuration. Pairs missing from
 * the table have strength {@value #DEFAULT_STRENGTH}.
 */
public final class CorrelationStrengthTable {

    public static final double DEFAULT_STRENGTH = 1.0;

    private final Map<String, Double> strengths;

    private CorrelationStrengthTable(Map<String, Double> strengths) {
        this.strengths = Collections.unmodifiableMap(new LinkedHashMap<>(strengths));
    }

    public static CorrelationStrengthTable empty() {
        return new CorrelationStrengthTable(Map.of());
    }

    /**
     * Table observed on historical results:
     * <pre>
     *   Efficiency + Matchup    1.5   both read the same defensive weakness
     *   Efficiency + GameScript 1.3
     *   Matchup    + GameScript 1.2
     *   Health     + Usage      1.1   injuries move snap counts directly
     *   Efficiency + Usage      1.0
     *   Health     + Matchup    0.9
     *   Trend      + Usage      0.7
     *   Trend      + Health     0.6
     *   Usage      + GameScript 0.6
     *   Variance   + Weather    0.5
     *   Trend      + Variance   0.5
     * </pre>
     */
    public static CorrelationStrengthTable defaults() {
        return builder()
            .pair("Efficiency", "Matchup",    1.5)
            .pair("Efficiency", "GameScript", 1.3)
            .pair("Matchup",    "GameScript", 1.2)
            .pair("Health",     "Usage",      1.1)
            .pair("Efficiency", "Usage",      1.0)
            .pair("Health",     "Matchup",    0.9)
            .pair("Trend",      "Usage",      0.7)
            .pair("Trend",      "Health",     0.6)
            .pair("Usage",      "GameScript", 0.6)
            .pair("Variance",   "Weather",    0.5)
            .pair("Trend",      "Variance",   0.5)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this table's pairs. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.strengths.putAll(strengths);
        return builder;
    }

    public double strengthOf(String first, String second) {
        return strengths.getOrDefault(key(first, second), DEFAULT_STRENGTH);
    }

    public int size() {
        return strengths.size();
    }

    private static String key(String first, String second) {
        return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
    }

    public static final class Builder {
        private final Map<String, Double> strengths = new LinkedHashMap<>();

        private Builder() {}

        public Builder pair(String first, String second, double strength) {
            if (first.equals(second)) {
                throw new IllegalArgumentException("Correlation pair needs two distinct evaluators: " + first);
            }
            if (strength <= 0.0) {
                throw new IllegalArgumentException(
                    "Correlation strength must be positive: " + first + "/" + second + "=" + strength);
            }
            strengths.put(key(first, second), strength);
            return this;
        }

        public CorrelationStrengthTable build() {
            return new CorrelationStrengthTable(strengths);
        }
    }
}
