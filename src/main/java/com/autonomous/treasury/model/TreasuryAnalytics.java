package com.autonomous.treasury.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class TreasuryAnalytics {
    int totalAgents;
    Map<BudgetStatus, Long> agentsByStatus;
    long totalBalance;
    long totalSpentToday;
    long totalSpent;
    long totalEarned;
    Double systemRoi;
    String topPerformer;
    boolean frozen;
    int pendingDurableWrites;
    long degradedAuditWrites;
    Instant generatedAt;
}
