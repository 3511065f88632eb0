package com.identity.reconciliation.store;

import com.identity.reconciliation.core.ReconciliationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runtime exception thrown when a store query, statement or transaction-control call fails.
 * Carries the classified {@link StoreErrorKind} so callers branch on the kind of failure
 * rather than on driver messages.
 */
public class StoreException extends ReconciliationException {

    private final StoreErrorKind kind;
    private final String statement;
    private final List<Object> arguments;

    public StoreException(String message, StoreErrorKind kind, Throwable cause) {
        this(message, kind, null, List.of(), cause);
    }

    public StoreException(String message, StoreErrorKind kind, String statement,
                          List<Object> arguments, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statement = statement;
        this.arguments = arguments != null
                ? Collections.unmodifiableList(new ArrayList<>(arguments))
                : List.of();
    }

    public StoreErrorKind kind() {
        return kind;
    }

    public boolean isUniqueViolation() {
        return kind == StoreErrorKind.UNIQUE_VIOLATION;
    }

    /**
     * The failing statement, or null when the failure was not tied to a statement.
     */
    public String statement() {
        return statement;
    }

    public List<Object> arguments() {
        return arguments;
    }
}
