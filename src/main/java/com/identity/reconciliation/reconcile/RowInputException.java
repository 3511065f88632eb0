package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.core.ReconciliationException;
import com.identity.reconciliation.core.model.ChangeRow;

/**
 * Runtime exception thrown when an input row is malformed: a required column is empty,
 * a date cannot be parsed, or the row attempts an unsupported change.
 */
public class RowInputException extends ReconciliationException {

    private final transient ChangeRow row;

    public RowInputException(String message, ChangeRow row) {
        super(message + " in " + row);
        this.row = row;
    }

    public RowInputException(String message, ChangeRow row, Throwable cause) {
        super(message + " in " + row, cause);
        this.row = row;
    }

    public ChangeRow getRow() {
        return row;
    }
}
