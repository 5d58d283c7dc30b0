package com.propplatform.common.model;

/**
 * Designation from the injury report. Players absent from the report are
 * not represented here; the context carries {@code null} for them.
 */
public enum InjuryStatus {
    OUT,
    INJURED_RESERVE,
    PUP,
    NFI,
    DOUBTFUL,
    QUESTIONABLE,
    ACTIVE;

    public boolean isUnavailable() {
        return this == OUT || this == INJURED_RESERVE || this == PUP || this == NFI;
    }
}
