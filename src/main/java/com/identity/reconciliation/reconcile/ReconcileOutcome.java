package com.identity.reconciliation.reconcile;

/**
 * Non-fatal result of reconciling one row. Hard errors are raised as exceptions instead.
 */
public enum ReconcileOutcome {
    /** An existing primary record and both dependent records were updated and committed. */
    UPDATED,
    /** A new enrollment was inserted and both dependent records were touched. */
    INSERTED,
    /** The stored state already matched the row. */
    UNCHANGED,
    /** Dry-run mode: the change was previewed but not written. */
    DRY_RUN,
    /** A uniqueness violation showed that an equivalent change is already stored. */
    COLLISION,
    /** The identity or the enrollment to update does not exist. */
    NOT_FOUND,
    /** More than one enrollment matched the row. */
    AMBIGUOUS,
    /** An organization name or project slug could not be resolved. */
    UNRESOLVED,
    /** One of the three writes affected no row; the transaction was rolled back. */
    PARTIAL_EFFECT;

    /**
     * Whether the row changed the store.
     */
    public boolean isWrite() {
        return this == UPDATED || this == INSERTED;
    }

    /**
     * Whether the row was skipped with a warning.
     */
    public boolean isWarning() {
        return this == NOT_FOUND || this == AMBIGUOUS || this == UNRESOLVED || this == PARTIAL_EFFECT;
    }
}
