package com.propplatform.history.store;

import com.propplatform.common.exception.PersistenceException;
import com.propplatform.common.model.CalibrationPeriod;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.WeightAdjustmentRecord;
import com.propplatform.common.store.EvaluatorWeightStore;
import com.propplatform.history.model.CalibrationPeriodRow;
import com.propplatform.history.model.EvaluatorWeightRow;
import com.propplatform.history.model.WeightAdjustmentRow;
import com.propplatform.history.repository.CalibrationPeriodRepository;
import com.propplatform.history.repository.EvaluatorWeightRepository;
import com.propplatform.history.repository.WeightAdjustmentRepository;
import io.r2dbc.spi.R2dbcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed {@link EvaluatorWeightStore}.
 *
 * <p>{@link #inTransaction} runs the work inside one R2DBC transaction that
 * first takes a transaction-scoped advisory lock, so concurrent calibrations
 * from different processes are serialised by the database. Repository calls
 * made while the work runs join that transaction through the Reactor Context,
 * which is why the transactional view is this same instance.
 *
 * <p>Every driver or mapping failure surfaces as {@link PersistenceException}.
 */
@Component
public class R2dbcEvaluatorWeightStore implements EvaluatorWeightStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcEvaluatorWeightStore.class);

    /** Advisory lock key shared by every writer of the weight tables. */
    static final long CALIBRATION_LOCK_KEY = 0x5745_4947_4854L;

    private final EvaluatorWeightRepository weightRepository;
    private final WeightAdjustmentRepository adjustmentRepository;
    private final CalibrationPeriodRepository periodRepository;
    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;

    public R2dbcEvaluatorWeightStore(EvaluatorWeightRepository weightRepository,
                                     WeightAdjustmentRepository adjustmentRepository,
                                     CalibrationPeriodRepository periodRepository,
                                     DatabaseClient databaseClient,
                                     TransactionalOperator transactionalOperator) {
        this.weightRepository      = weightRepository;
        this.adjustmentRepository  = adjustmentRepository;
        this.periodRepository      = periodRepository;
        this.databaseClient        = databaseClient;
        this.transactionalOperator = transactionalOperator;
    }

    @Override
    public Mono<List<EvaluatorWeight>> findAllWeights() {
        return weightRepository.findAll()
            .map(EvaluatorWeightRow::toDomain)
            .collect(Collectors.toList())
            .onErrorMap(e -> wrap("load evaluator weights", e));
    }

    @Override
    public Mono<EvaluatorWeight> findWeight(String evaluator) {
        return weightRepository.findById(evaluator)
            .map(EvaluatorWeightRow::toDomain)
            .onErrorMap(e -> wrap("load weight of " + evaluator, e));
    }

    @Override
    public Mono<EvaluatorWeight> saveWeight(EvaluatorWeight weight) {
        return weightRepository.upsertWeight(weight.evaluator(), weight.weight(), weight.lastUpdatedPeriod(),
                                             weight.sampleCount(), weight.cumulativeAccuracy(), weight.lastUpdated())
            .thenReturn(weight)
            .onErrorMap(e -> wrap("save weight of " + weight.evaluator(), e));
    }

    @Override
    public Mono<WeightAdjustmentRecord> appendAdjustment(WeightAdjustmentRecord record) {
        return adjustmentRepository.save(WeightAdjustmentRow.from(record))
            .map(WeightAdjustmentRow::toDomain)
            .onErrorMap(e -> wrap("append adjustment for " + record.evaluator() + " in " + record.period(), e));
    }

    @Override
    public Flux<WeightAdjustmentRecord> findAdjustments(String period) {
        return adjustmentRepository.findByPeriodOrderByIdAsc(period)
            .map(WeightAdjustmentRow::toDomain)
            .onErrorMap(e -> wrap("load adjustments of period " + period, e));
    }

    @Override
    public Flux<WeightAdjustmentRecord> findHistory(String evaluator, int limit) {
        Flux<WeightAdjustmentRow> rows = evaluator == null
            ? adjustmentRepository.findRecent(limit)
            : adjustmentRepository.findRecentByEvaluator(evaluator, limit);
        return rows.map(WeightAdjustmentRow::toDomain)
            .onErrorMap(e -> wrap("load adjustment history", e));
    }

    @Override
    public Mono<CalibrationPeriod> findPeriod(String period) {
        return periodRepository.findById(period)
            .map(CalibrationPeriodRow::toDomain)
            .onErrorMap(e -> wrap("load calibration period " + period, e));
    }

    @Override
    public Mono<CalibrationPeriod> markPeriod(CalibrationPeriod period) {
        return periodRepository.insertPeriod(period.period(), period.sampleCount(), period.calibratedAt())
            .thenReturn(period)
            .onErrorMap(e -> wrap("mark calibration period " + period.period(), e));
    }

    @Override
    public <T> Mono<T> inTransaction(Function<EvaluatorWeightStore, Mono<T>> work) {
        Mono<T> body = acquireLock().then(Mono.defer(() -> work.apply(this)));
        return transactionalOperator.transactional(body)
            .doOnError(e -> log.error("Weight store transaction rolled back. reason={}", e.getMessage()))
            .onErrorMap(e -> e instanceof DataAccessException || e instanceof R2dbcException,
                        e -> wrap("commit transaction", e));
    }

    private Mono<Void> acquireLock() {
        return databaseClient.sql("SELECT pg_advisory_xact_lock(:key)")
            .bind("key", CALIBRATION_LOCK_KEY)
            .then()
            .doOnSuccess(ignored -> log.debug("Calibration advisory lock acquired. key={}", CALIBRATION_LOCK_KEY))
            .onErrorMap(e -> wrap("acquire calibration lock", e));
    }

    private static Throwable wrap(String operation, Throwable e) {
        if (e instanceof PersistenceException) {
            return e;
        }
        return new PersistenceException("Failed to " + operation + ": " + e.getMessage(), e);
    }
}
