package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

public class InvalidAmountException extends PolicyDenialException {

    public InvalidAmountException(String agentId, long amount) {
        super(agentId, DenialReason.INVALID_AMOUNT, "Invalid amount " + amount + " - must be positive");
    }
}
