package com.propplatform.common.correlation;

import com.propplatform.common.model.ScoredProposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects legs of a bundle that are driven by the same evaluators and therefore
 * are not independent bets, even when their entities differ.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Each leg's drivers are its top-2 contributing evaluators.</li>
 *   <li>For every pair of legs, intersect the drivers. Empty → no penalty.</li>
 *   <li>Two shared drivers → strength {@code s} of that evaluator pair from the
 *       {@link CorrelationStrengthTable}; one shared driver → {@code s = 1.0}.</li>
 *   <li>Pair penalty {@code = −baseMagnitude × s}.</li>
 *   <li>Total penalty = sum over pairs, clamped to {@code floor}.</li>
 * </ol>
 *
 * <p>Bundles of fewer than two legs are not analysed. A leg without driver
 * metadata contributes nothing. Stateless and thread-safe.
 */
public class CorrelationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    public static final double DEFAULT_BASE_MAGNITUDE = 5.0;
    public static final double DEFAULT_FLOOR          = -20.0;

    private final CorrelationStrengthTable strengthTable;
    private final double baseMagnitude;
    private final double floor;

    public CorrelationAnalyzer(CorrelationStrengthTable strengthTable) {
        this(strengthTable, DEFAULT_BASE_MAGNITUDE, DEFAULT_FLOOR);
    }

    public CorrelationAnalyzer(CorrelationStrengthTable strengthTable, double baseMagnitude, double floor) {
        if (baseMagnitude < 0.0) {
            throw new IllegalArgumentException("baseMagnitude must be >= 0, was " + baseMagnitude);
        }
        if (floor > 0.0) {
            throw new IllegalArgumentException("floor must be <= 0, was " + floor);
        }
        this.strengthTable = strengthTable;
        this.baseMagnitude = baseMagnitude;
        this.floor         = floor;
    }

    public CorrelationAssessment analyze(List<ScoredProposition> legs) {
        if (legs == null || legs.size() < 2) {
            return CorrelationAssessment.NONE;
        }

        double total = 0.0;
        List<CorrelationWarning> warnings = new ArrayList<>();

        for (int i = 0; i < legs.size(); i++) {
            for (int j = i + 1; j < legs.size(); j++) {
                CorrelationWarning warning = assessPair(legs.get(i), legs.get(j));
                if (warning != null) {
                    total += warning.penalty();
                    warnings.add(warning);
                }
            }
        }

        double clamped = Math.max(total, floor);
        if (clamped != total) {
            log.debug("Correlation penalty clamped. raw={} floor={}", total, floor);
        }
        return new CorrelationAssessment(clamped, warnings);
    }

    /** Returns the warning for a correlated pair, or {@code null} when the legs share no driver. */
    CorrelationWarning assessPair(ScoredProposition first, ScoredProposition second) {
        Set<String> firstDrivers  = first.driverNames();
        Set<String> secondDrivers = second.driverNames();
        if (firstDrivers.isEmpty() || secondDrivers.isEmpty()) {
            log.debug("Skipping correlation for leg without driver metadata. first={} second={}",
                      first.entity(), second.entity());
            return null;
        }

        Set<String> shared = new TreeSet<>(firstDrivers);
        shared.retainAll(secondDrivers);
        if (shared.isEmpty()) {
            return null;
        }

        List<String> sharedList = new ArrayList<>(shared);
        double strength = sharedList.size() >= 2
            ? strengthTable.strengthOf(sharedList.get(0), sharedList.get(1))
            : CorrelationStrengthTable.DEFAULT_STRENGTH;
        double penalty  = -baseMagnitude * strength;
        CorrelationSeverity severity = CorrelationSeverity.fromStrength(strength);

        String message = String.format(Locale.ROOT,
            "%s severity: %s (%s) & %s (%s) both driven by %s (strength %.1f, %.1f)",
            severity, first.entity(), first.proposition().team(),
            second.entity(), second.proposition().team(),
            String.join(" + ", sharedList), strength, penalty);

        log.debug("Correlated legs. {}", message);
        return new CorrelationWarning(first.entity(), second.entity(), sharedList,
                                      strength, penalty, severity, message);
    }
}
