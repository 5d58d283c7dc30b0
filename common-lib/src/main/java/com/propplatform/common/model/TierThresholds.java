package com.propplatform.common.model;

/**
 * Minimum confidence for each recommendation tier; anything below {@code lean}
 * is {@link RecommendationTier#AVOID}. Thresholds must be non-increasing.
 */
public record TierThresholds(int elite, int strong, int moderate, int lean) {

    public static final TierThresholds DEFAULT = new TierThresholds(75, 70, 65, 60);

    public TierThresholds {
        if (!(elite >= strong && strong >= moderate && moderate >= lean)) {
            throw new IllegalArgumentException(
                "Tier thresholds must be non-increasing: elite=" + elite + " strong=" + strong
                    + " moderate=" + moderate + " lean=" + lean);
        }
    }

    public RecommendationTier tierFor(int confidence) {
        if (confidence >= elite)    return RecommendationTier.ELITE;
        if (confidence >= strong)   return RecommendationTier.STRONG;
        if (confidence >= moderate) return RecommendationTier.MODERATE;
        if (confidence >= lean)     return RecommendationTier.LEAN;
        return RecommendationTier.AVOID;
    }
}
