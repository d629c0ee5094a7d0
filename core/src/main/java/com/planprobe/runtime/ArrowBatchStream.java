package com.planprobe.runtime;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Reads a DuckDB result as Arrow batches through {@code arrowExportStream()}.
 *
 * <p>The stream owns the result set and its statement and closes both with
 * the reader. The root returned by {@link #current()} is reused for every
 * batch, so callers copy what they keep.
 *
 * <pre>{@code
 * try (ArrowBatchStream stream = ArrowBatchStream.export(rs, stmt, allocator, 8192)) {
 *     while (stream.loadNext()) {
 *         keep(copy(stream.current()));
 *     }
 *     Schema schema = stream.schema();
 * }
 * }</pre>
 */
public final class ArrowBatchStream implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArrowBatchStream.class);

    private final ArrowReader reader;
    private final ResultSet resultSet;
    private final Statement statement;

    private long rowCount;
    private int batchCount;
    private boolean closed;

    private ArrowBatchStream(ArrowReader reader, ResultSet resultSet, Statement statement) {
        this.reader = reader;
        this.resultSet = resultSet;
        this.statement = statement;
    }

    /**
     * Starts the Arrow export of a result set.
     *
     * @param resultSet DuckDB result set; owned by the stream from here on
     * @param statement statement that produced it; owned by the stream from here on
     * @param allocator allocator for the exported vectors
     * @param batchSize rows per batch hint
     * @return the stream
     * @throws SQLException if the export cannot start; the result set and statement are closed
     */
    public static ArrowBatchStream export(ResultSet resultSet,
                                          Statement statement,
                                          BufferAllocator allocator,
                                          int batchSize) throws SQLException {
        try {
            ArrowReader reader = (ArrowReader) resultSet.unwrap(DuckDBResultSet.class)
                .arrowExportStream(allocator, batchSize);
            logger.debug("Arrow export started with batchSize={}", batchSize);
            return new ArrowBatchStream(reader, resultSet, statement);
        } catch (SQLException | RuntimeException e) {
            release(resultSet, "result set");
            release(statement, "statement");
            if (e instanceof SQLException) {
                throw (SQLException) e;
            }
            throw new SQLException("Arrow export failed: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the next batch into {@link #current()}.
     *
     * @return false once the result is exhausted
     * @throws SQLException if the engine fails while producing the batch
     */
    public boolean loadNext() throws SQLException {
        if (closed) {
            throw new IllegalStateException("Stream is closed");
        }
        try {
            if (!reader.loadNextBatch()) {
                return false;
            }
        } catch (IOException | RuntimeException e) {
            throw new SQLException("Failed reading result batch " + (batchCount + 1) + ": " + e.getMessage(), e);
        }
        batchCount++;
        rowCount += current().getRowCount();
        logger.trace("Batch {}: {} rows (total: {})", batchCount, current().getRowCount(), rowCount);
        return true;
    }

    /**
     * Returns the reused root holding the last loaded batch.
     */
    public VectorSchemaRoot current() {
        try {
            return reader.getVectorSchemaRoot();
        } catch (IOException e) {
            throw new IllegalStateException("Arrow batch not available", e);
        }
    }

    /**
     * Returns the result schema; available even when the result has no rows.
     *
     * @throws SQLException if the engine cannot describe the result
     */
    public Schema schema() throws SQLException {
        try {
            return reader.getVectorSchemaRoot().getSchema();
        } catch (IOException e) {
            throw new SQLException("Result schema not available: " + e.getMessage(), e);
        }
    }

    public long rowCount() {
        return rowCount;
    }

    public int batchCount() {
        return batchCount;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        release(reader, "Arrow reader");
        release(resultSet, "result set");
        release(statement, "statement");
    }

    private static void release(AutoCloseable resource, String name) {
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
