package com.propplatform.common.model;

/**
 * Which side of a proposition's line is being wagered.
 */
public enum Side {
    OVER,
    UNDER;

    public Side opposite() {
        return this == OVER ? UNDER : OVER;
    }
}
