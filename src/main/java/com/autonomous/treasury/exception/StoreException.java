package com.autonomous.treasury.exception;

public class StoreException extends TreasuryException {

    private String transactionId;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getTransactionId() {
        return transactionId;
    }

    public StoreException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
