package com.identity.reconciliation.dispatch;

import com.identity.reconciliation.core.ReconciliationException;
import com.identity.reconciliation.core.model.ChangeRow;

/**
 * Runtime exception thrown when a phase stops on a hard error. Carries the phase, the row
 * that failed first (null when the failure is not tied to a row) and the original error.
 */
public class PhaseFailedException extends ReconciliationException {

    private final Phase phase;
    private final transient ChangeRow row;

    public PhaseFailedException(Phase phase, ChangeRow row, Throwable cause) {
        super(message(phase, row, cause), cause);
        this.phase = phase;
        this.row = row;
    }

    public Phase getPhase() {
        return phase;
    }

    public ChangeRow getRow() {
        return row;
    }

    private static String message(Phase phase, ChangeRow row, Throwable cause) {
        String where = row != null ? " at line " + row.lineNumber() : "";
        return "phase " + phase.label() + " failed" + where + ": " + cause.getMessage();
    }
}
