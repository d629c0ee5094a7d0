package com.planprobe.runtime;

import java.util.Objects;

/**
 * Quoting of identifiers and string literals embedded in generated DuckDB SQL.
 */
public final class SqlQuoting {

    private SqlQuoting() {}

    /**
     * Quote an identifier, doubling embedded double quotes.
     *
     * @param identifier the raw identifier
     * @return the quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quote a string literal, doubling embedded single quotes.
     *
     * @param value the raw value
     * @return the quoted literal
     */
    public static String quoteLiteral(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return "'" + value.replace("'", "''") + "'";
    }
}
