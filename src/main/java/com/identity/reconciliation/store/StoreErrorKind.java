package com.identity.reconciliation.store;

/**
 * Classification of store failures relevant to reconciliation.
 */
public enum StoreErrorKind {

    /**
     * A uniqueness constraint rejected the write: another actor already stored an equivalent record.
     */
    UNIQUE_VIOLATION,

    /**
     * Any other query, statement or transaction-control failure.
     */
    OTHER
}
