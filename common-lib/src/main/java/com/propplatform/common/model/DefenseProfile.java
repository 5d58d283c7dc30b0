package com.propplatform.common.model;

/**
 * Opponent defensive profile. DVOA values are from the offence's point of view:
 * positive means the defence allows more than average (a weak defence).
 *
 * <p>{@code vsWr1..vsRb} are position-specific coverage DVOAs.
 */
public record DefenseProfile(
    String team,
    double defenseDvoa,
    double passDefenseDvoa,
    double rushDefenseDvoa,
    double vsWr1Dvoa,
    double vsWr2Dvoa,
    double vsWr3Dvoa,
    double vsTeDvoa,
    double vsRbDvoa
) {}
