package com.autonomous.treasury.model;

public enum TransactionOutcome {
    SUCCESS,
    DENIED
}
