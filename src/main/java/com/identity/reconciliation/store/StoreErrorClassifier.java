package com.identity.reconciliation.store;

import java.sql.SQLException;

/**
 * Maps JDBC failures to a {@link StoreErrorKind} by SQLState and vendor code.
 *
 * <p>A uniqueness violation is reported either with the standard SQLState {@code 23505}
 * or, by MySQL and MariaDB drivers, with the generic integrity SQLState {@code 23000}
 * and vendor code {@code 1062} (duplicate entry).</p>
 */
public final class StoreErrorClassifier {

    static final String UNIQUE_VIOLATION_STATE = "23505";
    static final String INTEGRITY_VIOLATION_STATE = "23000";
    static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private StoreErrorClassifier() {
    }

    /**
     * Classifies an exception, inspecting chained SQL exceptions and causes.
     */
    public static StoreErrorKind classify(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql) {
                for (SQLException next = sql; next != null; next = next.getNextException()) {
                    if (isUniqueViolation(next)) {
                        return StoreErrorKind.UNIQUE_VIOLATION;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return StoreErrorKind.OTHER;
    }

    private static boolean isUniqueViolation(SQLException e) {
        String state = e.getSQLState();
        if (UNIQUE_VIOLATION_STATE.equals(state)) {
            return true;
        }
        return e.getErrorCode() == MYSQL_DUPLICATE_ENTRY
                && (state == null || INTEGRITY_VIOLATION_STATE.equals(state));
    }
}
