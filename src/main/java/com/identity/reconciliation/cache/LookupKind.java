package com.identity.reconciliation.cache;

/**
 * Kinds of foreign-key resolution performed through the {@link LookupCache}.
 */
public enum LookupKind {
    ORGANIZATION("Organization"),
    PROJECT_SLUG("Project slug");

    private final String label;

    LookupKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
