package com.identity.reconciliation.dispatch;

/**
 * Receives row counts while a phase runs: every hundred rows and once when the phase completes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param phase     the running phase
     * @param processed rows that have reported back so far
     * @param total     rows in the phase
     * @param completed true for the final report of the phase
     */
    void onProgress(Phase phase, long processed, long total, boolean completed);

    ProgressCallback NOOP = (phase, processed, total, completed) -> {};
}
