package com.identity.reconciliation.lock;

import com.identity.reconciliation.core.ReconciliationException;

/**
 * Runtime exception thrown when a per-entity lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends ReconciliationException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
