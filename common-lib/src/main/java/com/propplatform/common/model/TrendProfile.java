package com.propplatform.common.model;

/** Recent opportunity trend for the entity. */
public record TrendProfile(
    TrendDirection snapShareTrend,
    TrendDirection targetShareTrend
) {}
