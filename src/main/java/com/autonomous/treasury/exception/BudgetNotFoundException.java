package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

public class BudgetNotFoundException extends PolicyDenialException {

    public BudgetNotFoundException(String agentId) {
        super(agentId, DenialReason.BUDGET_NOT_FOUND, "Budget for agent '" + agentId + "' not found");
    }
}
