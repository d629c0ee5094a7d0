package com.planprobe.source;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * An external columnar relation that can be bound into a session.
 *
 * <p>The session calls {@link #open} once at registration time to learn the
 * schema and statistics, then defines a view over {@link #scanExpression()};
 * the engine scans the source whenever a query runs.
 */
public interface RelationSource {

    /**
     * Read the source's schema and statistics.
     *
     * @param connection connection to run metadata queries on
     * @return the descriptor
     * @throws SQLException if the source is unreadable or malformed
     */
    SourceDescriptor open(Connection connection) throws SQLException;

    /**
     * The SQL table expression that scans the source.
     *
     * @return e.g. {@code read_parquet('/data/runs.parquet')}
     */
    String scanExpression();

    /**
     * Location shown in logs and errors.
     *
     * @return the path or URI
     */
    String location();
}
