package com.propplatform.common.model;

public enum RecommendationTier {
    ELITE,
    STRONG,
    MODERATE,
    LEAN,
    AVOID
}
