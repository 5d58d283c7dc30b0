package com.propplatform.history.repository;

import com.propplatform.history.model.EvaluatorWeightRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface EvaluatorWeightRepository extends ReactiveCrudRepository<EvaluatorWeightRow, String> {

    /**
     * Inserts the evaluator's row or replaces every column of the existing one.
     * The natural key means {@code save()} cannot tell an insert from an update.
     */
    @Modifying
    @Query("""
        INSERT INTO evaluator_weight
            (evaluator_name, weight, last_updated_period, sample_count, cumulative_accuracy, last_updated)
        VALUES
            (:evaluatorName, :weight, :lastUpdatedPeriod, :sampleCount, :cumulativeAccuracy, :lastUpdated)
        ON CONFLICT (evaluator_name) DO UPDATE SET
            weight              = EXCLUDED.weight,
            last_updated_period = EXCLUDED.last_updated_period,
            sample_count        = EXCLUDED.sample_count,
            cumulative_accuracy = EXCLUDED.cumulative_accuracy,
            last_updated        = EXCLUDED.last_updated
        """)
    Mono<Void> upsertWeight(String evaluatorName, double weight, String lastUpdatedPeriod,
                            long sampleCount, double cumulativeAccuracy, Instant lastUpdated);
}
