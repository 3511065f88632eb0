package com.identity.reconciliation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One input line: an ordered mapping of column name to raw string value.
 * This is the unit of work handed to a reconciler.
 */
public final class ChangeRow {

    private final long lineNumber;
    private final Map<String, String> values;

    public ChangeRow(long lineNumber, Map<String, String> values) {
        Objects.requireNonNull(values, "values is required");
        this.lineNumber = lineNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates a row without source line information.
     */
    public static ChangeRow of(Map<String, String> values) {
        return new ChangeRow(0, values);
    }

    /**
     * Returns the raw value of a column, or an empty string when the column is absent.
     */
    public String get(String column) {
        String value = values.get(column);
        return value != null ? value : "";
    }

    /**
     * Returns the whitespace-trimmed value of a column, or an empty string when absent.
     */
    public String trimmed(String column) {
        return get(column).trim();
    }

    public boolean has(String column) {
        return !trimmed(column).isEmpty();
    }

    public long lineNumber() {
        return lineNumber;
    }

    public Map<String, String> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeRow other)) return false;
        return lineNumber == other.lineNumber && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, values);
    }

    @Override
    public String toString() {
        return "line " + lineNumber + " " + values;
    }
}
