package com.propplatform.common.model;

public enum TrendDirection {
    INCREASING,
    STABLE,
    DECREASING
}
