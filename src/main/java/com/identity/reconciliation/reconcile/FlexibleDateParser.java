package com.identity.reconciliation.reconcile;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses input dates, trying accepted formats from most to least specific.
 * Only the calendar date is kept; missing month or day default to the first.
 */
public final class FlexibleDateParser {

    // four-digit years only
    private static final int MIN_YEAR = 1000;
    private static final int MAX_YEAR = 9999;

    // seconds may carry a fraction of any precision
    private static final List<DateTimeFormatter> FORMATTERS = List.of(
            withFraction("uuuu-MM-dd'T'HH:mm:ss", "'Z'"),
            withFraction("uuuu-MM-dd HH:mm:ss", ""),
            formatter("uuuu-MM-dd HH:mm"),
            formatter("uuuu-MM-dd HH"),
            formatter("uuuu-MM-dd"),
            formatter("uuuu-MM"),
            formatter("uuuu")
    );

    private FlexibleDateParser() {
    }

    /**
     * Parses a trimmed, non-empty date string.
     *
     * @return the date, or empty when no accepted format matches
     */
    public static Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (DateTimeFormatter formatter : FORMATTERS) {
            try {
                LocalDate date = LocalDate.from(formatter.parse(value));
                if (date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR) {
                    return Optional.of(date);
                }
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return finish(new DateTimeFormatterBuilder().appendPattern(pattern));
    }

    private static DateTimeFormatter withFraction(String pattern, String suffix) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                .optionalEnd();
        if (!suffix.isEmpty()) {
            builder.appendPattern(suffix);
        }
        return finish(builder);
    }

    private static DateTimeFormatter finish(DateTimeFormatterBuilder builder) {
        return builder
                .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
