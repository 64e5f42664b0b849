package com.autonomous.treasury.model;

public enum BudgetStatus {
    ACTIVE,
    SUSPENDED,
    DECOMMISSIONED
}
