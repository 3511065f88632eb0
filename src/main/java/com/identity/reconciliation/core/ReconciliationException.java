package com.identity.reconciliation.core;

/**
 * Base runtime exception for failures that stop a reconciliation run.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
