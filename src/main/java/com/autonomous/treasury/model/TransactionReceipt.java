package com.autonomous.treasury.model;

import com.autonomous.treasury.exception.AuditWriteDegradedException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Returned for a committed balance change. {@code auditWarning} is set when the transaction
 * is not yet durable; the balance change itself stands.
 */
@Value
@Builder
public class TransactionReceipt {
    String transactionId;
    String agentId;
    long balanceAfter;
    long spentToday;

    @JsonIgnore
    AuditWriteDegradedException auditWarning;

    public boolean isAuditDegraded() {
        return auditWarning != null;
    }
}
