package com.propplatform.common.store;

import com.propplatform.common.exception.PersistenceException;
import com.propplatform.common.model.CalibrationPeriod;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.WeightAdjustmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Heap-backed {@link EvaluatorWeightStore}.
 *
 * <p>Transactions run against a private copy of the state that replaces the
 * committed state only when the work completes successfully; an error discards
 * the copy. A single permit serialises transactions.
 */
public class InMemoryEvaluatorWeightStore implements EvaluatorWeightStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEvaluatorWeightStore.class);

    private final Semaphore writer = new Semaphore(1);
    private volatile State committed = new State();

    public InMemoryEvaluatorWeightStore() {}

    public InMemoryEvaluatorWeightStore(List<EvaluatorWeight> seed) {
        State initial = new State();
        seed.forEach(w -> initial.weights.put(w.evaluator(), w));
        this.committed = initial;
    }

    @Override
    public Mono<List<EvaluatorWeight>> findAllWeights() {
        return new View(committed).findAllWeights();
    }

    @Override
    public Mono<EvaluatorWeight> findWeight(String evaluator) {
        return new View(committed).findWeight(evaluator);
    }

    @Override
    public Mono<EvaluatorWeight> saveWeight(EvaluatorWeight weight) {
        return inTransaction(tx -> tx.saveWeight(weight));
    }

    @Override
    public Mono<WeightAdjustmentRecord> appendAdjustment(WeightAdjustmentRecord record) {
        return inTransaction(tx -> tx.appendAdjustment(record));
    }

    @Override
    public Flux<WeightAdjustmentRecord> findAdjustments(String period) {
        return new View(committed).findAdjustments(period);
    }

    @Override
    public Flux<WeightAdjustmentRecord> findHistory(String evaluator, int limit) {
        return new View(committed).findHistory(evaluator, limit);
    }

    @Override
    public Mono<CalibrationPeriod> findPeriod(String period) {
        return new View(committed).findPeriod(period);
    }

    @Override
    public Mono<CalibrationPeriod> markPeriod(CalibrationPeriod period) {
        return inTransaction(tx -> tx.markPeriod(period));
    }

    @Override
    public <T> Mono<T> inTransaction(Function<EvaluatorWeightStore, Mono<T>> work) {
        return Mono.defer(() -> {
            if (!writer.tryAcquire()) {
                return Mono.error(new PersistenceException("Weight store is locked by another transaction"));
            }
            State staged = committed.copy();
            return Mono.defer(() -> work.apply(new View(staged)))
                .doOnSuccess(ignored -> {
                    committed = staged;
                    log.debug("In-memory transaction committed. weights={} records={}",
                              staged.weights.size(), staged.records.size());
                })
                .doOnError(e -> log.debug("In-memory transaction rolled back. reason={}", e.getMessage()))
                .doFinally(signal -> writer.release());
        });
    }

    private static final class State {
        final Map<String, EvaluatorWeight> weights = new LinkedHashMap<>();
        final List<WeightAdjustmentRecord> records = new ArrayList<>();
        final Map<String, CalibrationPeriod> periods = new LinkedHashMap<>();

        State copy() {
            State copy = new State();
            copy.weights.putAll(weights);
            copy.records.addAll(records);
            copy.periods.putAll(periods);
            return copy;
        }
    }

    /** Reads and writes against one {@link State}; writes are only visible once that state is committed. */
    private static final class View implements EvaluatorWeightStore {
        private final State state;

        View(State state) {
            this.state = state;
        }

        @Override
        public Mono<List<EvaluatorWeight>> findAllWeights() {
            return Mono.fromCallable(() -> List.copyOf(state.weights.values()));
        }

        @Override
        public Mono<EvaluatorWeight> findWeight(String evaluator) {
            return Mono.justOrEmpty(state.weights.get(evaluator));
        }

        @Override
        public Mono<EvaluatorWeight> saveWeight(EvaluatorWeight weight) {
            return Mono.fromCallable(() -> {
                state.weights.put(weight.evaluator(), weight);
                return weight;
            });
        }

        @Override
        public Mono<WeightAdjustmentRecord> appendAdjustment(WeightAdjustmentRecord record) {
            return Mono.fromCallable(() -> {
                state.records.add(record);
                return record;
            });
        }

        @Override
        public Flux<WeightAdjustmentRecord> findAdjustments(String period) {
            return Flux.defer(() -> Flux.fromIterable(List.copyOf(state.records)))
                .filter(r -> period.equals(r.period()));
        }

        @Override
        public Flux<WeightAdjustmentRecord> findHistory(String evaluator, int limit) {
            return Flux.defer(() -> {
                List<WeightAdjustmentRecord> newestFirst = new ArrayList<>(state.records);
                Collections.reverse(newestFirst);
                return Flux.fromIterable(newestFirst);
            })
                .filter(r -> evaluator == null || evaluator.equals(r.evaluator()))
                .take(limit);
        }

        @Override
        public Mono<CalibrationPeriod> findPeriod(String period) {
            return Mono.justOrEmpty(state.periods.get(period));
        }

        @Override
        public Mono<CalibrationPeriod> markPeriod(CalibrationPeriod period) {
            return Mono.fromCallable(() -> {
                state.periods.put(period.period(), period);
                return period;
            });
        }

        @Override
        public <T> Mono<T> inTransaction(Function<EvaluatorWeightStore, Mono<T>> work) {
            return Mono.defer(() -> work.apply(this));
        }
    }
}
