package com.autonomous.treasury.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Why an authorization attempt was refused. The code is what lands in the audit trail.
 */
public enum DenialReason {
    EMERGENCY_FREEZE("emergency_freeze", true),
    INVALID_AMOUNT("invalid_amount", true),
    BUDGET_NOT_FOUND("budget_not_found", true),
    AGENT_INACTIVE("agent_inactive", true),
    PER_ACTION("per_action", true),
    DAILY("daily", true),
    INSUFFICIENT_FUNDS("insufficient_funds", true),
    CONTENTION("contention", false),
    CANCELLED("cancelled", false),
    STORE_UNAVAILABLE("store_unavailable", false);

    private final String code;
    private final boolean policy;

    DenialReason(String code, boolean policy) {
        this.code = code;
        this.policy = policy;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Policy denials are expected business outcomes; the rest are infrastructure
     * conditions the caller may retry.
     */
    public boolean isPolicy() {
        return policy;
    }

    @JsonCreator
    public static DenialReason fromCode(String code) {
        return Arrays.stream(values())
            .filter(r -> r.code.equals(code) || r.name().equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown denial reason: " + code));
    }
}
