package com.autonomous.treasury.exception;

/**
 * The calling thread was interrupted before the update committed. Nothing was written.
 */
public class OperationCancelledException extends TreasuryException {

    private String transactionId;

    public OperationCancelledException(String key) {
        super("Update of '" + key + "' cancelled before commit");
    }

    public String getTransactionId() {
        return transactionId;
    }

    public OperationCancelledException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
