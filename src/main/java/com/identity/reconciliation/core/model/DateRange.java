package com.identity.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Affiliation period. Open boundaries are stored as sentinel dates, never as NULL.
 *
 * @param start first day of the period
 * @param end   last day of the period
 */
public record DateRange(LocalDate start, LocalDate end) {

    /** Stand-in for an open start boundary. */
    public static final LocalDate OPEN_START = LocalDate.of(1900, 1, 1);

    /** Stand-in for an open end boundary. */
    public static final LocalDate OPEN_END = LocalDate.of(2100, 1, 1);

    public DateRange {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
    }

    /**
     * Builds a range, substituting the sentinels for missing boundaries.
     */
    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start != null ? start : OPEN_START, end != null ? end : OPEN_END);
    }

    public static DateRange open() {
        return new DateRange(OPEN_START, OPEN_END);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
