package com.autonomous.treasury.model;

import lombok.Data;

/**
 * One agent's provisioning entry, read from {@code config/agents/*.yaml}.
 * Unset amounts fall back to the configured defaults.
 */
@Data
public class AgentBudgetDefinition {
    private String agentId;
    private Long seedAmount;
    private Long dailyLimit;
    private Long perActionLimit;
    private String timeZone;
}
