package com.autonomous.treasury.exception;

/**
 * Base class for everything the treasury engine throws.
 */
public class TreasuryException extends RuntimeException {

    public TreasuryException(String message) {
        super(message);
    }

    public TreasuryException(String message, Throwable cause) {
        super(message, cause);
    }
}
