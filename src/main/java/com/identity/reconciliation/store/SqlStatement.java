package com.identity.reconciliation.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parameterized SQL statement together with its bound arguments.
 *
 * @param sql       statement text with {@code ?} placeholders
 * @param arguments positional arguments
 */
public record SqlStatement(String sql, List<Object> arguments) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql is required");
        arguments = arguments != null
                ? Collections.unmodifiableList(new ArrayList<>(arguments))
                : List.of();
    }

    public static SqlStatement of(String sql, Object... arguments) {
        return new SqlStatement(sql, Arrays.asList(arguments));
    }

    @Override
    public String toString() {
        return sql + " " + arguments;
    }
}
