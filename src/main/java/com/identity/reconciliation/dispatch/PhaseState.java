package com.identity.reconciliation.dispatch;

/**
 * Lifecycle of a phase: rows are admitted while {@code RUNNING}; after the last row or the
 * first hard error the phase is {@code DRAINING} until every in-flight row has reported.
 */
public enum PhaseState {
    NOT_STARTED,
    RUNNING,
    DRAINING,
    DONE
}
