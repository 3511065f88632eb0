package com.identity.reconciliation.core.model;

/**
 * Identity columns that reconciliation compares and rewrites.
 */
public enum IdentityField {
    NAME("name"),
    USERNAME("username"),
    EMAIL("email");

    private final String column;

    IdentityField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
