package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

/**
 * {@link DenialReason#PER_ACTION} or {@link DenialReason#DAILY}.
 */
public class UsageLimitExceededException extends PolicyDenialException {

    private final long requested;
    private final long limit;

    public UsageLimitExceededException(String agentId, DenialReason reason, long requested, long limit) {
        super(agentId, reason, String.format("Agent '%s' exceeded %s limit: requested %d, allowed %d",
            agentId, reason.code(), requested, limit));
        this.requested = requested;
        this.limit = limit;
    }

    public long getRequested() {
        return requested;
    }

    public long getLimit() {
        return limit;
    }
}
