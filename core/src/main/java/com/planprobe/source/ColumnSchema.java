package com.planprobe.source;

import java.util.Objects;

/**
 * One column of a registered relation, with the engine's type name.
 *
 * @param name the column name
 * @param engineType the DuckDB type, e.g. {@code VARCHAR} or {@code BLOB}
 */
public record ColumnSchema(String name, String engineType) {

    public ColumnSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(engineType, "engineType must not be null");
    }

    @Override
    public String toString() {
        return name + " " + engineType;
    }
}
