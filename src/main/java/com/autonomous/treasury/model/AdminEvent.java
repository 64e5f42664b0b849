package com.autonomous.treasury.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Entry in the administrative log, kept apart from the spend ledger.
 * {@code agentId} is null for system-wide events such as a freeze.
 */
@Value
@Builder
@Jacksonized
public class AdminEvent {
    String eventId;
    AdminEventType type;
    String agentId;
    String actor;
    String reason;
    String details;
    Instant timestamp;
}
