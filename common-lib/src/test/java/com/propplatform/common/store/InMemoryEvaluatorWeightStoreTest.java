package com.propplatform.common.store;

import com.propplatform.common.exception.PersistenceException;
import com.propplatform.common.model.AdjustmentAction;
import com.propplatform.common.model.CalibrationPeriod;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.WeightAdjustmentRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEvaluatorWeightStoreTest {

    private static WeightAdjustmentRecord record(String evaluator, String period, double oldWeight, double newWeight) {
        return new WeightAdjustmentRecord(evaluator, oldWeight, newWeight, AdjustmentAction.APPLIED,
                                          "overconfident", period, 0.55, 0.15, 20, Instant.EPOCH);
    }

    @Test
    @DisplayName("seeded weights are readable")
    void seeded() {
        InMemoryEvaluatorWeightStore store =
            new InMemoryEvaluatorWeightStore(List.of(EvaluatorWeight.initial("Usage", 1.6)));

        StepVerifier.create(store.findWeight("Usage"))
            .assertNext(w -> assertEquals(1.6, w.weight()))
            .verifyComplete();
        StepVerifier.create(store.findWeight("Trend")).verifyComplete();
    }

    @Test
    @DisplayName("successful transaction commits every write")
    void commit() {
        InMemoryEvaluatorWeightStore store = new InMemoryEvaluatorWeightStore();

        StepVerifier.create(store.inTransaction(tx -> tx.saveWeight(EvaluatorWeight.initial("Matchup", 1.55))
                .then(tx.appendAdjustment(record("Matchup", "W1", 2.0, 1.55)))
                .then(tx.markPeriod(new CalibrationPeriod("W1", 20, Instant.EPOCH)))))
            .expectNextCount(1)
            .verifyComplete();

        StepVerifier.create(store.findAllWeights())
            .assertNext(weights -> assertEquals(1, weights.size()))
            .verifyComplete();
        StepVerifier.create(store.findAdjustments("W1")).expectNextCount(1).verifyComplete();
        StepVerifier.create(store.findPeriod("W1")).expectNextCount(1).verifyComplete();
    }

    @Test
    @DisplayName("failed transaction leaves no partial writes behind")
    void rollback() {
        InMemoryEvaluatorWeightStore store =
            new InMemoryEvaluatorWeightStore(List.of(EvaluatorWeight.initial("Matchup", 2.0)));

        Mono<Object> work = store.inTransaction(tx -> tx.saveWeight(EvaluatorWeight.initial("Matchup", 1.55))
            .then(tx.appendAdjustment(record("Matchup", "W1", 2.0, 1.55)))
            .then(Mono.error(new PersistenceException("disk full"))));

        StepVerifier.create(work).expectError(PersistenceException.class).verify();

        StepVerifier.create(store.findWeight("Matchup"))
            .assertNext(w -> assertEquals(2.0, w.weight()))
            .verifyComplete();
        StepVerifier.create(store.findAdjustments("W1")).verifyComplete();
        StepVerifier.create(store.findPeriod("W1")).verifyComplete();
    }

    @Test
    @DisplayName("reads inside a transaction see its own staged writes")
    void readYourWrites() {
        InMemoryEvaluatorWeightStore store = new InMemoryEvaluatorWeightStore();

        StepVerifier.create(store.inTransaction(tx -> tx.saveWeight(EvaluatorWeight.initial("Trend", 1.1))
                .then(tx.findWeight("Trend"))))
            .assertNext(w -> assertEquals(1.1, w.weight()))
            .verifyComplete();
    }

    @Test
    @DisplayName("a second transaction is refused while the first holds the store")
    void singleWriter() {
        InMemoryEvaluatorWeightStore store = new InMemoryEvaluatorWeightStore();
        Sinks.One<String> gate = Sinks.one();

        Mono<String> first = store.inTransaction(tx -> gate.asMono());
        first.subscribe();

        StepVerifier.create(store.inTransaction(tx -> Mono.just("second")))
            .expectError(PersistenceException.class)
            .verify();

        gate.tryEmitValue("done");
        StepVerifier.create(store.inTransaction(tx -> Mono.just("third")))
            .expectNext("third")
            .verifyComplete();
    }

    @Test
    @DisplayName("history is newest first, filterable by evaluator and limited")
    void history() {
        InMemoryEvaluatorWeightStore store = new InMemoryEvaluatorWeightStore();
        store.appendAdjustment(record("Usage", "W1", 1.8, 1.7)).block();
        store.appendAdjustment(record("Trend", "W1", 1.2, 1.3)).block();
        store.appendAdjustment(record("Usage", "W2", 1.7, 1.6)).block();

        StepVerifier.create(store.findHistory(null, 2))
            .assertNext(r -> assertEquals("W2", r.period()))
            .assertNext(r -> assertEquals("Trend", r.evaluator()))
            .verifyComplete();

        StepVerifier.create(store.findHistory("Usage", 10))
            .assertNext(r -> assertEquals(1.6, r.newWeight()))
            .assertNext(r -> assertEquals(1.7, r.newWeight()))
            .verifyComplete();
    }
}
