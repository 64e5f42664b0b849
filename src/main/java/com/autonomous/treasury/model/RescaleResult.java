package com.autonomous.treasury.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RescaleResult {
    String agentId;
    PerformanceTier tier;
    Double roi;
    double multiplier;
    long oldDailyLimit;
    long newDailyLimit;
    long oldPerActionLimit;
    long newPerActionLimit;
    boolean applied;
}
