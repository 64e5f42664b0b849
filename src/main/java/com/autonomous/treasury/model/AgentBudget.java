package com.autonomous.treasury.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Financial state of one agent. All money is in minor currency units (cents).
 *
 * <p>{@code currentBalance}, {@code spentToday} and {@code lastResetDate} are written only by
 * the budget registry; {@code dailyLimit} and {@code perActionLimit} only by the performance
 * scaler. {@code version} increases by one on every committed mutation.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentBudget {
    private String agentId;

    private long currentBalance;
    private long dailyLimit;
    private long perActionLimit;
    private long spentToday;
    private LocalDate lastResetDate;
    private String timeZone;

    @Builder.Default
    private BudgetStatus status = BudgetStatus.ACTIVE;

    // Lifetime analytics
    private long totalSpent;
    private long totalEarned;
    private long totalTransactions;
    private double roiScore;

    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public long availableDailyBudget() {
        return Math.max(0, dailyLimit - spentToday);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == BudgetStatus.ACTIVE;
    }
}
