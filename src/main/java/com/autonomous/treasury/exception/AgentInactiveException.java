package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.DenialReason;

public class AgentInactiveException extends PolicyDenialException {

    private final BudgetStatus status;

    public AgentInactiveException(String agentId, BudgetStatus status) {
        super(agentId, DenialReason.AGENT_INACTIVE,
            String.format("Agent '%s' is %s", agentId, status.name().toLowerCase()));
        this.status = status;
    }

    public BudgetStatus getStatus() {
        return status;
    }
}
