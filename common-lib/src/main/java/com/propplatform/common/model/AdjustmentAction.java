package com.propplatform.common.model;

public enum AdjustmentAction {
    APPLIED,
    SKIPPED
}
