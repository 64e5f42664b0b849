package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

/**
 * An authorization that was refused by policy. The attempt is already in the audit trail
 * under {@link #getTransactionId()} by the time this reaches the caller.
 */
public abstract class PolicyDenialException extends TreasuryException {

    private final String agentId;
    private final DenialReason reason;
    private String transactionId;

    protected PolicyDenialException(String agentId, DenialReason reason, String message) {
        super(message);
        this.agentId = agentId;
        this.reason = reason;
    }

    public String getAgentId() {
        return agentId;
    }

    public DenialReason getReason() {
        return reason;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public PolicyDenialException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
