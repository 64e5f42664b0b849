package com.autonomous.treasury.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerState {
    private boolean frozen;
    private String reason;
    private String actor;
    private Instant timestamp;

    public static CircuitBreakerState open() {
        return new CircuitBreakerState(false, null, null, null);
    }
}
