package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.core.model.ChangeRow;

/**
 * Reconciles a single input row against the store.
 */
@FunctionalInterface
public interface RowReconciler {

    /**
     * Applies the minimal change described by the row.
     *
     * @param row     the input row
     * @param context the run-scoped caches, locks and aggregates
     * @return the non-fatal outcome
     * @throws RowInputException if the row is malformed
     * @throws com.identity.reconciliation.store.StoreException on store failures other than collisions
     * @throws com.identity.reconciliation.lock.LockAcquisitionException if a per-entity lock times out
     */
    ReconcileOutcome reconcile(ChangeRow row, RunContext context);
}
