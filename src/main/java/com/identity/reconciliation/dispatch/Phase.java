package com.identity.reconciliation.dispatch;

/**
 * The two ordered phases of a run.
 */
public enum Phase {
    IDENTITIES("identities"),
    ENROLLMENTS("enrollments");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    /**
     * Lower-case name used in log context and metric tags.
     */
    public String label() {
        return label;
    }
}
