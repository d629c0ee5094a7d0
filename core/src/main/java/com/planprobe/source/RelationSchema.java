package com.planprobe.source;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered column list of a relation.
 */
public final class RelationSchema {

    private final List<ColumnSchema> columns;

    public RelationSchema(List<ColumnSchema> columns) {
        this.columns = List.copyOf(columns);
    }

    public List<ColumnSchema> columns() {
        return columns;
    }

    /**
     * Finds a column by name, ignoring case like DuckDB's binder does.
     *
     * @param name the column name
     * @return the column, or empty if absent
     */
    public Optional<ColumnSchema> column(String name) {
        return columns.stream()
            .filter(column -> column.name().equalsIgnoreCase(name))
            .findFirst();
    }

    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationSchema)) return false;
        return columns.equals(((RelationSchema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.stream().map(ColumnSchema::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
