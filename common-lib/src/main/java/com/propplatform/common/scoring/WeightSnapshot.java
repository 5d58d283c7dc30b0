package com.propplatform.common.scoring;

import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.SignalFamily;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of evaluator weights taken once at the start of a scoring run.
 * Calibration writes that land after the snapshot was taken do not affect the run.
 *
 * <p>Evaluators absent from the snapshot fall back to their signal family's
 * default weight ({@link SignalFamily#defaultWeightOf(String)}).
 */
public final class WeightSnapshot {

    private static final WeightSnapshot DEFAULTS = new WeightSnapshot(Map.of());

    private final Map<String, Double> weights;

    private WeightSnapshot(Map<String, Double> weights) {
        this.weights = Map.copyOf(weights);
    }

    public static WeightSnapshot defaults() {
        return DEFAULTS;
    }

    public static WeightSnapshot of(Map<String, Double> weights) {
        return new WeightSnapshot(weights);
    }

    public static WeightSnapshot fromWeights(Collection<EvaluatorWeight> stored) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (EvaluatorWeight w : stored) {
            map.put(w.evaluator(), w.weight());
        }
        return new WeightSnapshot(map);
    }

    /**
     * Returns a copy with {@code overrides} layered on top. Overrides win over
     * stored weights; a zero override disables the evaluator.
     */
    public WeightSnapshot withOverrides(Map<String, Double> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<String, Double> merged = new LinkedHashMap<>(weights);
        merged.putAll(overrides);
        return new WeightSnapshot(merged);
    }

    public double weightFor(String evaluatorName) {
        Double stored = weights.get(evaluatorName);
        return stored != null ? stored : SignalFamily.defaultWeightOf(evaluatorName);
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return "WeightSnapshot" + weights;
    }
}
