package com.propplatform.history.repository;

import com.propplatform.history.model.CalibrationPeriodRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface CalibrationPeriodRepository extends ReactiveCrudRepository<CalibrationPeriodRow, String> {

    /** Fails on a duplicate period, which rolls back the surrounding calibration. */
    @Modifying
    @Query("""
        INSERT INTO calibration_period (period, sample_count, calibrated_at)
        VALUES (:period, :sampleCount, :calibratedAt)
        """)
    Mono<Void> insertPeriod(String period, int sampleCount, Instant calibratedAt);
}
