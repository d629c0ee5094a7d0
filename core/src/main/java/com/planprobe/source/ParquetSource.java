package com.planprobe.source;

import com.planprobe.runtime.SqlQuoting;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parquet file (or glob of files) read through DuckDB's {@code read_parquet}.
 *
 * <p>Supported locations:
 * <ul>
 *   <li>Single file: {@code data/runs.parquet}</li>
 *   <li>Glob pattern: {@code data/runs_*.parquet}</li>
 *   <li>Remote URI, when the engine has the matching extension loaded</li>
 * </ul>
 *
 * <p>Statistics come from the Parquet footers via {@code parquet_metadata},
 * without reading any data pages.
 */
public class ParquetSource implements RelationSource {

    private final String location;

    public ParquetSource(String location) {
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    public static ParquetSource of(Path path) {
        return new ParquetSource(path.toAbsolutePath().toString());
    }

    @Override
    public SourceDescriptor open(Connection connection) throws SQLException {
        if (isPlainLocalPath() && !Files.isReadable(Path.of(location))) {
            throw new SQLException("IO Error: No such file or not readable: " + location);
        }

        List<ColumnSchema> columns = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("DESCRIBE SELECT * FROM " + scanExpression())) {
            while (rs.next()) {
                columns.add(new ColumnSchema(rs.getString("column_name"), rs.getString("column_type")));
            }
        }

        String literal = SqlQuoting.quoteLiteral(location);
        String statsSql =
            "SELECT COUNT(DISTINCT file_name), COUNT(*), CAST(COALESCE(SUM(num_rows), 0) AS BIGINT) " +
            "FROM (SELECT file_name, row_group_id, MAX(row_group_num_rows) AS num_rows " +
            "FROM parquet_metadata(" + literal + ") GROUP BY file_name, row_group_id)";
        SourceStatistics statistics;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(statsSql)) {
            if (!rs.next()) {
                throw new SQLException("parquet_metadata returned no rows for " + location);
            }
            statistics = new SourceStatistics(rs.getLong(1), rs.getLong(2), rs.getLong(3));
        }

        return new SourceDescriptor(new RelationSchema(columns), statistics);
    }

    @Override
    public String scanExpression() {
        return "read_parquet(" + SqlQuoting.quoteLiteral(location) + ")";
    }

    @Override
    public String location() {
        return location;
    }

    private boolean isPlainLocalPath() {
        return !location.contains("://")
            && location.chars().noneMatch(c -> c == '*' || c == '?' || c == '[');
    }

    @Override
    public String toString() {
        return "ParquetSource[" + location + "]";
    }
}
