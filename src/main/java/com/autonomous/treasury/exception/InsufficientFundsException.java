package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

public class InsufficientFundsException extends PolicyDenialException {

    private final long required;
    private final long available;

    public InsufficientFundsException(String agentId, long required, long available) {
        super(agentId, DenialReason.INSUFFICIENT_FUNDS, String.format(
            "Agent '%s' has insufficient funds: required %d, available %d", agentId, required, available));
        this.required = required;
        this.available = available;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
