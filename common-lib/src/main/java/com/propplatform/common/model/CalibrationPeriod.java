package com.propplatform.common.model;

import java.time.Instant;

/**
 * Marker that a calibration period has been committed. The period key is the
 * idempotency guard: a period is applied at most once.
 */
public record CalibrationPeriod(String period, int sampleCount, Instant calibratedAt) {}
