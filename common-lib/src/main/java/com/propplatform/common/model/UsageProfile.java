package com.propplatform.common.model;

/**
 * Usage share of the entity. Percentages are 0–100; per-game averages for
 * attempts. Unknown metrics are reported as 0.
 */
public record UsageProfile(
    double snapSharePct,
    double targetSharePct,
    double touchPct,
    double rushAttemptPct,
    double passAttempts,
    double rushAttempts,
    TrendDirection trend
) {}
