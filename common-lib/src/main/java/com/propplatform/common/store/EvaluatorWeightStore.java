package com.propplatform.common.store;

import com.propplatform.common.model.CalibrationPeriod;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.WeightAdjustmentRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * Persistence contract for evaluator weights and their audit trail.
 *
 * <p>Weights are keyed by evaluator name. Adjustment records are append-only.
 * Calibration periods act as idempotency keys. No storage engine is assumed.
 *
 * <p>Implementations report failures as
 * {@link com.propplatform.common.exception.PersistenceException}.
 */
public interface EvaluatorWeightStore {

    Mono<List<EvaluatorWeight>> findAllWeights();

    /** @return the stored weight, or empty when the evaluator has never been stored */
    Mono<EvaluatorWeight> findWeight(String evaluator);

    Mono<EvaluatorWeight> saveWeight(EvaluatorWeight weight);

    Mono<WeightAdjustmentRecord> appendAdjustment(WeightAdjustmentRecord record);

    /** Audit records written for {@code period}, in insertion order. */
    Flux<WeightAdjustmentRecord> findAdjustments(String period);

    /**
     * Most recent audit records first.
     *
     * @param evaluator restrict to one evaluator, or {@code null} for all
     */
    Flux<WeightAdjustmentRecord> findHistory(String evaluator, int limit);

    Mono<CalibrationPeriod> findPeriod(String period);

    Mono<CalibrationPeriod> markPeriod(CalibrationPeriod period);

    /**
     * Runs {@code work} as one atomic read-modify-write against a transactional
     * view of this store. Either every write made through the view is committed
     * or none is. Only one transaction holds the store at a time.
     */
    <T> Mono<T> inTransaction(Function<EvaluatorWeightStore, Mono<T>> work);
}
