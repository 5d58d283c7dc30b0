package com.propplatform.history.repository;

import com.propplatform.history.model.WeightAdjustmentRow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface WeightAdjustmentRepository extends ReactiveCrudRepository<WeightAdjustmentRow, Long> {

    Flux<WeightAdjustmentRow> findByPeriodOrderByIdAsc(String period);

    @Query("SELECT * FROM weight_adjustment_history ORDER BY id DESC LIMIT :limit")
    Flux<WeightAdjustmentRow> findRecent(int limit);

    @Query("""
        SELECT * FROM weight_adjustment_history
        WHERE evaluator_name = :evaluatorName
        ORDER BY id DESC
        LIMIT :limit
        """)
    Flux<WeightAdjustmentRow> findRecentByEvaluator(String evaluatorName, int limit);
}
