package com.propplatform.analysis.service;

import com.propplatform.analysis.config.BundleProperties;
import com.propplatform.common.correlation.CorrelationAnalyzer;
import com.propplatform.common.correlation.CorrelationAssessment;
import com.propplatform.common.exception.ValidationException;
import com.propplatform.common.model.Bundle;
import com.propplatform.common.model.BundleRisk;
import com.propplatform.common.model.ScoredProposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines scored propositions into bundles of 2–5 legs.
 *
 * <h3>Selection</h3>
 * Eligible legs (confidence at or above the minimum, with a signal) are grouped
 * by game context. Each bundle is filled round-robin across contexts, starting
 * one context further along than the previous bundle, so no single game
 * dominates the output. Within a context, entities not yet used by an earlier
 * bundle come first, then higher confidence.
 *
 * <h3>Constraints</h3>
 * <ul>
 *   <li>An entity appears at most once per bundle; this also rules out both
 *       sides of one line in the same bundle.</li>
 *   <li>Each side of each line is used in at most one bundle.</li>
 *   <li>An entity is used in at most {@code maxEntityUses} bundles.</li>
 * </ul>
 * A requested bundle that cannot be filled is skipped, not shrunk.
 *
 * <h3>Pricing</h3>
 * <pre>
 *   naive    = mean(leg confidence)
 *   adjusted = clamp(naive + correlation penalty, 0, 100)
 *   EV       = (adjusted − 50) × 2
 * </pre>
 */
@Service
public class BundleBuilder {

    private static final Logger log = LoggerFactory.getLogger(BundleBuilder.class);

    public static final int MIN_LEGS = 2;
    public static final int MAX_LEGS = 5;

    private static final Comparator<ScoredProposition> BY_CONFIDENCE_DESC =
        Comparator.comparingInt(ScoredProposition::confidence).reversed()
                  .thenComparing(s -> s.proposition().legKey());

    private final CorrelationAnalyzer correlationAnalyzer;
    private final BundleProperties properties;

    public BundleBuilder(CorrelationAnalyzer correlationAnalyzer, BundleProperties properties) {
        this.correlationAnalyzer = correlationAnalyzer;
        this.properties          = properties;
    }

    /** Builds the configured default plan at the configured minimum confidence. */
    public List<Bundle> buildBundles(List<ScoredProposition> pool) {
        return buildBundles(pool, properties.getPlan(), properties.getMinConfidence());
    }

    /**
     * @param sizes         leg count of each requested bundle, in build order
     * @param minConfidence legs below this confidence are never used
     */
    public List<Bundle> buildBundles(List<ScoredProposition> pool, List<Integer> sizes, double minConfidence) {
        validate(sizes, minConfidence);

        List<List<ScoredProposition>> contexts = groupByContext(pool, minConfidence);
        Set<String> usedLegs = new HashSet<>();
        Map<String, Integer> entityUses = new HashMap<>();
        List<Bundle> bundles = new ArrayList<>();

        for (int i = 0; i < sizes.size(); i++) {
            int size = sizes.get(i);
            List<ScoredProposition> legs = fill(contexts, i, size, usedLegs, entityUses);
            if (legs.size() < size) {
                log.warn("Skipping {}-leg bundle #{}: only {} eligible legs left", size, i + 1, legs.size());
                continue;
            }
            for (ScoredProposition leg : legs) {
                usedLegs.add(leg.proposition().legKey());
                entityUses.merge(leg.entity(), 1, Integer::sum);
            }
            Bundle bundle = price(legs);
            bundles.add(bundle);
            log.info("Built {}-leg bundle. naive={} penalty={} adjusted={} risk={} units={}",
                     size, round1(bundle.naiveConfidence()), bundle.correlationPenalty(),
                     round1(bundle.adjustedConfidence()), bundle.riskLevel(), bundle.recommendedUnits());
        }

        log.info("Bundle build complete. requested={} built={} eligibleContexts={} entitiesUsed={}",
                 sizes.size(), bundles.size(), contexts.size(), entityUses.size());
        return bundles;
    }

    /** Prices an already chosen set of legs. */
    public Bundle price(List<ScoredProposition> legs) {
        double naive = legs.stream().mapToInt(ScoredProposition::confidence).average().orElse(0.0);
        CorrelationAssessment assessment = correlationAnalyzer.analyze(legs);
        double adjusted = assessment.applyTo(naive);
        BundleRisk risk = riskOf(legs);
        return new Bundle(legs, naive, assessment.penalty(), adjusted, assessment.warnings(),
                          risk, expectedValue(adjusted), recommendedUnits(risk, adjusted));
    }

    private List<ScoredProposition> fill(List<List<ScoredProposition>> contexts, int bundleIndex, int size,
                                         Set<String> usedLegs, Map<String, Integer> entityUses) {
        List<ScoredProposition> legs = new ArrayList<>();
        Set<String> entities = new HashSet<>();
        if (contexts.isEmpty()) return legs;

        int start = bundleIndex % contexts.size();
        boolean progressed = true;
        while (legs.size() < size && progressed) {
            progressed = false;
            for (int offset = 0; offset < contexts.size() && legs.size() < size; offset++) {
                List<ScoredProposition> context = contexts.get((start + offset) % contexts.size());
                ScoredProposition pick = pick(context, usedLegs, entities, entityUses);
                if (pick != null) {
                    legs.add(pick);
                    entities.add(pick.entity());
                    progressed = true;
                }
            }
        }
        return legs;
    }

    private ScoredProposition pick(List<ScoredProposition> context, Set<String> usedLegs,
                                   Set<String> entitiesInBundle, Map<String, Integer> entityUses) {
        ScoredProposition reused = null;
        for (ScoredProposition candidate : context) {
            int uses = entityUses.getOrDefault(candidate.entity(), 0);
            if (usedLegs.contains(candidate.proposition().legKey())
                || entitiesInBundle.contains(candidate.entity())
                || uses >= properties.getMaxEntityUses()) {
                continue;
            }
            if (uses == 0) return candidate;
            if (reused == null) reused = candidate;
        }
        return reused;
    }

    private List<List<ScoredProposition>> groupByContext(List<ScoredProposition> pool, double minConfidence) {
        Map<String, List<ScoredProposition>> byContext = new LinkedHashMap<>();
        pool.stream()
            .filter(s -> !s.noSignal() && s.confidence() >= minConfidence)
            .sorted(BY_CONFIDENCE_DESC)
            .forEach(s -> byContext.computeIfAbsent(s.proposition().contextKey(), k -> new ArrayList<>()).add(s));
        return new ArrayList<>(byContext.values());
    }

    /**
     * <pre>
     *   all legs from one game : 2 legs MODERATE, 3–4 HIGH, 5 VERY_HIGH
     *   every leg a new game   : LOW
     *   otherwise              : MODERATE
     * </pre>
     */
    static BundleRisk riskOf(List<ScoredProposition> legs) {
        long games = legs.stream().map(s -> s.proposition().contextKey()).distinct().count();
        if (games == 1) {
            if (legs.size() <= 2) return BundleRisk.MODERATE;
            if (legs.size() <= 4) return BundleRisk.HIGH;
            return BundleRisk.VERY_HIGH;
        }
        return games == legs.size() ? BundleRisk.LOW : BundleRisk.MODERATE;
    }

    static double expectedValue(double adjustedConfidence) {
        return (adjustedConfidence - 50.0) * 2.0;
    }

    static double recommendedUnits(BundleRisk risk, double adjustedConfidence) {
        return switch (risk) {
            case VERY_HIGH -> 0.5;
            case HIGH      -> adjustedConfidence >= 70 ? 1.0 : 0.5;
            case MODERATE  -> adjustedConfidence >= 70 ? 1.5 : 1.0;
            case LOW       -> adjustedConfidence >= 65 ? 1.5 : 1.0;
        };
    }

    private void validate(List<Integer> sizes, double minConfidence) {
        if (sizes == null || sizes.isEmpty()) {
            throw new ValidationException("sizes", "at least one bundle size is required");
        }
        for (Integer size : sizes) {
            if (size == null || size < MIN_LEGS || size > MAX_LEGS) {
                throw new ValidationException("sizes",
                    "bundle size must be between " + MIN_LEGS + " and " + MAX_LEGS + ", was " + size);
            }
        }
        if (!Double.isFinite(minConfidence) || minConfidence < 0 || minConfidence > 100) {
            throw new ValidationException("minConfidence", "must be within [0, 100], was " + minConfidence);
        }
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
