package com.autonomous.treasury.exception;

/**
 * Optimistic update gave up after the configured number of attempts. Transient: the caller
 * may retry.
 */
public class ContentionExceededException extends TreasuryException {

    private final String key;
    private final int attempts;
    private String transactionId;

    public ContentionExceededException(String key, int attempts) {
        super(String.format("Gave up updating '%s' after %d conflicting attempts", key, attempts));
        this.key = key;
        this.attempts = attempts;
    }

    public String getKey() {
        return key;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public ContentionExceededException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
