package com.autonomous.treasury.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable audit record. Debits carry a negative {@code amount}; a denied spend records the
 * amount that was requested, with no balance change.
 */
@Value
@Builder
@Jacksonized
public class Transaction {
    String transactionId;
    String agentId;
    TransactionType type;
    long amount;
    String description;
    Instant timestamp;
    TransactionOutcome outcome;
    DenialReason denialReason;
    Long balanceBefore;
    Long balanceAfter;
    RoiData roiData;

    @Builder.Default
    String processedBy = "treasury";

    @JsonIgnore
    public boolean isSuccessful() {
        return outcome == TransactionOutcome.SUCCESS;
    }

    @JsonIgnore
    public boolean isDebit() {
        return amount < 0;
    }
}
