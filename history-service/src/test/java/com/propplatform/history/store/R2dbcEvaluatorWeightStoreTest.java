package com.propplatform.history.store;

import com.propplatform.common.exception.PersistenceException;
import com.propplatform.common.model.AdjustmentAction;
import com.propplatform.common.model.EvaluatorWeight;
import com.propplatform.common.model.WeightAdjustmentRecord;
import com.propplatform.history.model.EvaluatorWeightRow;
import com.propplatform.history.model.WeightAdjustmentRow;
import com.propplatform.history.repository.CalibrationPeriodRepository;
import com.propplatform.history.repository.EvaluatorWeightRepository;
import com.propplatform.history.repository.WeightAdjustmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class R2dbcEvaluatorWeightStoreTest {

    @Mock private EvaluatorWeightRepository weightRepository;
    @Mock private WeightAdjustmentRepository adjustmentRepository;
    @Mock private CalibrationPeriodRepository periodRepository;
    @Mock private DatabaseClient databaseClient;
    @Mock private DatabaseClient.GenericExecuteSpec lockSpec;
    @Mock private TransactionalOperator transactionalOperator;

    private R2dbcEvaluatorWeightStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        store = new R2dbcEvaluatorWeightStore(weightRepository, adjustmentRepository, periodRepository,
                                              databaseClient, transactionalOperator);
        when(databaseClient.sql(anyString())).thenReturn(lockSpec);
        when(lockSpec.bind(eq("key"), any())).thenReturn(lockSpec);
        when(lockSpec.then()).thenReturn(Mono.empty());
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static EvaluatorWeightRow row(String name, double weight) {
        EvaluatorWeightRow row = new EvaluatorWeightRow();
        row.setEvaluatorName(name);
        row.setWeight(weight);
        return row;
    }

    @Test
    @DisplayName("rows are mapped to domain weights")
    void findAllWeights() {
        when(weightRepository.findAll()).thenReturn(Flux.just(row("Efficiency", 2.2), row("Trend", 1.1)));

        StepVerifier.create(store.findAllWeights())
            .assertNext(weights -> {
                assertEquals(2, weights.size());
                assertEquals("Efficiency", weights.get(0).evaluator());
                assertEquals(1.1, weights.get(1).weight());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("driver failures surface as PersistenceException")
    void readFailureWrapped() {
        when(weightRepository.findAll()).thenReturn(Flux.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(store.findAllWeights())
            .expectErrorSatisfies(e -> {
                assertInstanceOf(PersistenceException.class, e);
                assertTrue(e.getMessage().contains("connection refused"));
            })
            .verify();
    }

    @Test
    @DisplayName("saveWeight upserts every column of the weight")
    void saveWeightUpserts() {
        Instant now = Instant.parse("2024-10-21T08:00:00Z");
        EvaluatorWeight weight = new EvaluatorWeight("Matchup", 1.55, "2024-W07", 20, 0.55, now);
        when(weightRepository.upsertWeight("Matchup", 1.55, "2024-W07", 20L, 0.55, now)).thenReturn(Mono.empty());

        StepVerifier.create(store.saveWeight(weight))
            .expectNext(weight)
            .verifyComplete();
        verify(weightRepository).upsertWeight("Matchup", 1.55, "2024-W07", 20L, 0.55, now);
    }

    @Test
    @DisplayName("audit records are stored as rows with the action name")
    void appendAdjustment() {
        WeightAdjustmentRecord record = new WeightAdjustmentRecord("Usage", 1.8, 1.8, AdjustmentAction.SKIPPED,
            "insufficient data", "2024-W07", 0.5, 0.1, 8, Instant.EPOCH);
        ArgumentCaptor<WeightAdjustmentRow> saved = ArgumentCaptor.forClass(WeightAdjustmentRow.class);
        when(adjustmentRepository.save(saved.capture())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(store.appendAdjustment(record))
            .expectNext(record)
            .verifyComplete();
        assertEquals("SKIPPED", saved.getValue().getAction());
        assertNull(saved.getValue().getId());
    }

    @Test
    @DisplayName("history without an evaluator reads across all evaluators")
    void historyRouting() {
        when(adjustmentRepository.findRecent(5)).thenReturn(Flux.empty());

        StepVerifier.create(store.findHistory(null, 5)).verifyComplete();
        verify(adjustmentRepository).findRecent(5);
        verify(adjustmentRepository, never()).findRecentByEvaluator(anyString(), anyInt());
    }

    @Test
    @DisplayName("transactions take the advisory lock before running the work")
    void transactionTakesLock() {
        StepVerifier.create(store.inTransaction(tx -> Mono.just("done")))
            .expectNext("done")
            .verifyComplete();

        verify(databaseClient).sql("SELECT pg_advisory_xact_lock(:key)");
        verify(lockSpec).bind("key", R2dbcEvaluatorWeightStore.CALIBRATION_LOCK_KEY);
    }

    @Test
    @DisplayName("a lock failure aborts the transaction as PersistenceException")
    void lockFailure() {
        when(lockSpec.then()).thenReturn(Mono.error(new DataAccessResourceFailureException("lock timeout")));

        StepVerifier.create(store.inTransaction(tx -> Mono.just("never")))
            .expectError(PersistenceException.class)
            .verify();
    }

    @Test
    @DisplayName("errors raised by the work itself pass through unchanged")
    void workErrorsNotWrapped() {
        StepVerifier.create(store.inTransaction(tx -> Mono.error(new IllegalStateException("bad plan"))))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
