package com.propplatform.common.model;

/** Route alignment split for a pass catcher. */
public record AlignmentProfile(
    double slotPct,
    double widePct,
    double slotYardsPerRoute,
    double wideYardsPerRoute
) {}
