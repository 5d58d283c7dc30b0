package com.propplatform.common.model;

public enum Position {
    QB,
    RB,
    WR,
    TE;

    public boolean isPassCatcher() {
        return this == WR || this == TE;
    }

    /** QB, WR and TE: positions whose output is driven by the passing game. */
    public boolean isPassingGame() {
        return this == QB || this == WR || this == TE;
    }
}
