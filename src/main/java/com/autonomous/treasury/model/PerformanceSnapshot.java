package com.autonomous.treasury.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Derived view over an agent's recent transactions; never stored.
 */
@Value
@Builder
public class PerformanceSnapshot {
    String agentId;
    Instant windowStart;
    Instant windowEnd;
    long totalSpent;
    long totalValueGenerated;
    int transactionCount;

    public boolean hasSpend() {
        return totalSpent > 0;
    }

    /**
     * {@code NaN} when nothing was spent in the window.
     */
    public double roi() {
        return hasSpend() ? (double) totalValueGenerated / totalSpent : Double.NaN;
    }

    public PerformanceTier tier() {
        return PerformanceTier.forRoi(roi());
    }
}
