package com.autonomous.treasury.model;

public enum AdminEventType {
    FREEZE,
    UNFREEZE,
    BUDGET_PROVISIONED,
    STATUS_CHANGED,
    LIMITS_RESCALED
}
