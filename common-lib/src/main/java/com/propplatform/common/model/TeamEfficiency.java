package com.propplatform.common.model;

/**
 * Offensive efficiency of the entity's team, as DVOA percentages
 * (positive = better than league average).
 */
public record TeamEfficiency(
    String team,
    double offenseDvoa,
    double passingDvoa,
    double rushingDvoa
) {}
