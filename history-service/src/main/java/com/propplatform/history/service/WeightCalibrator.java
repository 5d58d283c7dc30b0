package com.propplatform.history.service;

import com.propplatform.common.calibration.AccuracyMeasurer;
import com.propplatform.common.calibration.CalibrationPolicy;
import com.propplatform.common.calibration.EvaluatorAccuracy;
import com.propplatform.common.calibration.WeightAdjustment;
import com.propplatform.common.calibration.WeightAdjustmentCalculator;
import com.propplatform.common.exception.CalibrationInProgressException;
import com.propplatform.common.exception.PersistenceException;
import com.propplatform.common.exception.ValidationException;
import com.propplatform.common.model.CalibrationPeriod;
import com.propplatform.common.model.CalibrationSample;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.ScoredProposition;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.WeightAdjustmentRecord;
import com.propplatform.common.provider.OutcomeProvider;
import com.propplatform.common.store.EvaluatorWeightStore;
import com.propplatform.common.trace.RunContextUtil;
import com.propplatform.history.config.CalibrationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Moves each evaluator's weight toward its observed reliability, one
 * calibration period at a time.
 *
 * <h3>Per period</h3>
 * <ol>
 *   <li>Grade every evaluator on the propositions it contributed to
 *       ({@link AccuracyMeasurer}).</li>
 *   <li>Compute the bounded adjustment ({@link WeightAdjustmentCalculator}).</li>
 *   <li>Persist new weights, one audit record per evaluator and the period
 *       marker, all in one store transaction.</li>
 * </ol>
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>Single writer: a second call while one is running fails with
 *       {@link CalibrationInProgressException}.</li>
 *   <li>Idempotent: a period that is already marked returns its stored audit
 *       records and writes nothing.</li>
 *   <li>Atomic: a store failure rolls back the whole period and surfaces as
 *       {@link PersistenceException}.</li>
 * </ul>
 */
@Service
public class WeightCalibrator {

    private static final Logger log = LoggerFactory.getLogger(WeightCalibrator.class);

    private final EvaluatorWeightStore weightStore;
    private final Optional<OutcomeProvider> outcomeProvider;
    private final CalibrationProperties properties;
    private final CalibrationPolicy policy;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WeightCalibrator(EvaluatorWeightStore weightStore,
                            Optional<OutcomeProvider> outcomeProvider,
                            CalibrationProperties properties) {
        this.weightStore     = weightStore;
        this.outcomeProvider = outcomeProvider;
        this.properties      = properties;
        this.policy          = properties.toPolicy();
    }

    /**
     * Applies one calibration period.
     *
     * @return the audit records of the period, one per evaluator, in evaluator order;
     *         empty when auto-learning is disabled
     */
    public Mono<List<WeightAdjustmentRecord>> calibrate(String period, List<CalibrationSample> samples) {
        String runId = RunContextUtil.newRunId();
        Mono<List<WeightAdjustmentRecord>> run = Mono.defer(() -> {
            validate(period, samples);
            if (!properties.isEnabled()) {
                RunContextUtil.withMdc(runId, () ->
                    log.info("Auto-learning disabled; calibration skipped. period={}", period));
                return Mono.just(List.<WeightAdjustmentRecord>of());
            }
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new CalibrationInProgressException(period));
            }
            return Mono.defer(() -> weightStore.inTransaction(tx -> tx.findPeriod(period)
                    .flatMap(existing -> alreadyCalibrated(tx, existing, samples.size(), runId))
                    .switchIfEmpty(Mono.defer(() -> apply(tx, period, samples, runId)))))
                .doOnError(e -> RunContextUtil.withMdc(runId, () ->
                    log.error("Calibration failed; period rolled back. period={} reason={}",
                              period, e.getMessage())))
                .onErrorMap(e -> !(e instanceof PersistenceException), e ->
                    new PersistenceException("Calibration of period " + period + " failed: " + e.getMessage(), e))
                .doFinally(signal -> running.set(false));
        });
        return RunContextUtil.withRunId(run, runId);
    }

    /**
     * Calibrates from scored propositions, looking up each outcome through the
     * configured {@link OutcomeProvider}. Propositions without an outcome yet
     * are left out.
     */
    public Mono<List<WeightAdjustmentRecord>> calibrateFromOutcomes(String period, List<ScoredProposition> scored) {
        return resolveOutcomes(scored).flatMap(samples -> calibrate(period, samples));
    }

    /** Computes the adjustments {@link #calibrate} would make, without writing anything. */
    public Mono<List<WeightAdjustmentRecord>> preview(String period, List<CalibrationSample> samples) {
        return Mono.defer(() -> {
            validate(period, samples);
            return weightStore.findAllWeights()
                .map(weights -> plan(index(weights), samples, period, Instant.now()).stream()
                    .map(PlannedAdjustment::record)
                    .collect(Collectors.toList()));
        });
    }

    /** Most recent audit records first; {@code evaluator} may be null for all evaluators. */
    public Flux<WeightAdjustmentRecord> history(String evaluator, int limit) {
        if (limit <= 0) {
            return Flux.error(new ValidationException("limit", "must be positive, was " + limit));
        }
        return weightStore.findHistory(evaluator, limit);
    }

    public Flux<WeightAdjustmentRecord> history(String evaluator) {
        return history(evaluator, properties.getDefaultHistoryLimit());
    }

    public boolean isRunning() {
        return running.get();
    }

    private Mono<List<WeightAdjustmentRecord>> alreadyCalibrated(EvaluatorWeightStore tx, CalibrationPeriod existing,
                                                                 int sampleCount, String runId) {
        RunContextUtil.withMdc(runId, () -> {
            if (existing.sampleCount() != sampleCount) {
                log.warn("Period already calibrated with a different sample set; returning stored records. "
                         + "period={} storedSamples={} offeredSamples={}",
                         existing.period(), existing.sampleCount(), sampleCount);
            } else {
                log.info("Period already calibrated; returning stored records. period={}", existing.period());
            }
        });
        return tx.findAdjustments(existing.period()).collect(Collectors.toList());
    }

    private Mono<List<WeightAdjustmentRecord>> apply(EvaluatorWeightStore tx, String period,
                                                     List<CalibrationSample> samples, String runId) {
        Instant now = Instant.now();
        return tx.findAllWeights()
            .map(weights -> plan(index(weights), samples, period, now))
            .flatMap(planned -> Flux.fromIterable(planned)
                .concatMap(p -> (p.updatedWeight() != null ? tx.saveWeight(p.updatedWeight()).then() : Mono.<Void>empty())
                    .then(tx.appendAdjustment(p.record())))
                .collect(Collectors.toList())
                .flatMap(records -> tx.markPeriod(new CalibrationPeriod(period, samples.size(), now))
                    .thenReturn(records))
                .doOnNext(records -> logApplied(period, planned, runId)));
    }

    private List<PlannedAdjustment> plan(Map<String, EvaluatorWeight> stored, List<CalibrationSample> samples,
                                         String period, Instant now) {
        Map<String, EvaluatorAccuracy> accuracy = AccuracyMeasurer.measure(samples, stored.keySet());
        List<PlannedAdjustment> planned = new ArrayList<>();
        for (EvaluatorAccuracy stats : accuracy.values()) {
            EvaluatorWeight current = stored.get(stats.evaluator());
            double oldWeight = current != null ? current.weight() : SignalFamily.defaultWeightOf(stats.evaluator());
            WeightAdjustment adjustment = WeightAdjustmentCalculator.adjust(oldWeight, stats, policy);
            EvaluatorWeight updated = adjustment.applied() ? updatedWeight(current, adjustment, stats, period, now) : null;
            planned.add(new PlannedAdjustment(adjustment.toRecord(period, now), updated));
        }
        return planned;
    }

    private static EvaluatorWeight updatedWeight(EvaluatorWeight current, WeightAdjustment adjustment,
                                                 EvaluatorAccuracy stats, String period, Instant now) {
        long previousSamples = current != null ? current.sampleCount() : 0L;
        double previousHits  = current != null ? current.cumulativeAccuracy() * previousSamples : 0.0;
        long totalSamples    = previousSamples + stats.sampleSize();
        double cumulative    = totalSamples == 0 ? 0.0 : (previousHits + stats.hits()) / totalSamples;
        return new EvaluatorWeight(adjustment.evaluator(), adjustment.newWeight(), period,
                                   totalSamples, cumulative, now);
    }

    private Mono<List<CalibrationSample>> resolveOutcomes(List<ScoredProposition> scored) {
        if (outcomeProvider.isEmpty()) {
            return Mono.error(new IllegalStateException("No OutcomeProvider configured"));
        }
        OutcomeProvider provider = outcomeProvider.get();
        return Flux.fromIterable(scored)
            .concatMap(s -> provider.getOutcome(s.proposition().id())
                .map(outcome -> new CalibrationSample(s, outcome)))
            .collect(Collectors.toList())
            .doOnNext(samples -> log.info("Resolved outcomes. scored={} withOutcome={}",
                                          scored.size(), samples.size()));
    }

    private void logApplied(String period, List<PlannedAdjustment> planned, String runId) {
        long applied = planned.stream().filter(p -> p.updatedWeight() != null).count();
        RunContextUtil.withMdc(runId, () -> {
            for (PlannedAdjustment p : planned) {
                WeightAdjustmentRecord r = p.record();
                log.info("Weight {} evaluator={} {} -> {} reason=\"{}\" accuracy={} samples={}",
                         r.action(), r.evaluator(), r.oldWeight(), r.newWeight(), r.reason(),
                         r.accuracy(), r.sampleSize());
            }
            log.info("Calibration applied. period={} evaluators={} applied={} skipped={}",
                     period, planned.size(), applied, planned.size() - applied);
        });
    }

    private static Map<String, EvaluatorWeight> index(List<EvaluatorWeight> weights) {
        return weights.stream().collect(Collectors.toMap(
            EvaluatorWeight::evaluator, Function.identity(), (a, b) -> b, LinkedHashMap::new));
    }

    private static void validate(String period, List<CalibrationSample> samples) {
        if (period == null || period.isBlank()) {
            throw new ValidationException("period", "must not be blank");
        }
        if (samples == null) {
            throw new ValidationException("samples", "must not be null");
        }
    }

    /** @param updatedWeight new stored weight, or null when the adjustment was skipped */
    private record PlannedAdjustment(WeightAdjustmentRecord record, EvaluatorWeight updatedWeight) {}
}
