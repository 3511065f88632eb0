package com.identity.reconciliation.core.model;

/**
 * Enrollment columns that reconciliation compares and rewrites.
 */
public enum EnrollmentField {
    ORGANIZATION_ID("organization_id"),
    START("start"),
    END("end");

    private final String column;

    EnrollmentField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
