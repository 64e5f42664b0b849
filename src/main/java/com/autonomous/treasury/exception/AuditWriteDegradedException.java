package com.autonomous.treasury.exception;

/**
 * A transaction could not be made durable right away and is buffered for retry.
 * Never thrown out of an authorization; it rides along on the receipt as a warning.
 */
public class AuditWriteDegradedException extends TreasuryException {

    private final String transactionId;

    public AuditWriteDegradedException(String transactionId, Throwable cause) {
        super("Audit write for transaction " + transactionId + " is degraded; buffered for retry", cause);
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
