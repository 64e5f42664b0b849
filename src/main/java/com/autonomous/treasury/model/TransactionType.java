package com.autonomous.treasury.model;

public enum TransactionType {
    SEED_FUNDING,   // initial allocation on provisioning
    SPENDING,       // every authorize attempt
    EARNING         // realized value credited back to the agent
}
