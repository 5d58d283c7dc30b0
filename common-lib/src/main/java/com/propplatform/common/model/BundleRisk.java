package com.propplatform.common.model;

public enum BundleRisk {
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH
}
