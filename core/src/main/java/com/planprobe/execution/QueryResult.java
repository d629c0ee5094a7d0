package com.planprobe.execution;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The fully materialized result of one execution run.
 *
 * <p>Holds every batch in the order the engine produced them, the result
 * schema (available even when no rows came back) and the run's timing.
 * Closing the result releases the Arrow memory of all batches.
 */
public final class QueryResult implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryResult.class);

    private final String sql;
    private final Schema schema;
    private final List<RowBatch> batches;
    private final Timing timing;
    private final BufferAllocator allocator;
    private boolean closed = false;

    QueryResult(String sql, Schema schema, List<RowBatch> batches, Timing timing, BufferAllocator allocator) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.batches = List.copyOf(batches);
        this.timing = Objects.requireNonNull(timing, "timing must not be null");
        this.allocator = allocator;
    }

    /**
     * Creates a result over batches built outside the runner; the result
     * takes ownership of the batches but not of their allocator.
     *
     * @param sql the SQL the batches answer
     * @param schema the result schema
     * @param batches the batches
     * @param timing the timing
     * @return the result
     */
    public static QueryResult of(String sql, Schema schema, List<RowBatch> batches, Timing timing) {
        return new QueryResult(sql, schema, batches, timing, null);
    }

    public String sql() {
        return sql;
    }

    public Schema schema() {
        return schema;
    }

    public List<RowBatch> batches() {
        return batches;
    }

    public Timing timing() {
        return timing;
    }

    /**
     * Sum of the batch row counts.
     *
     * @return total rows
     */
    public long totalRows() {
        long total = 0;
        for (RowBatch batch : batches) {
            total += batch.rowCount();
        }
        return total;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (RowBatch batch : batches) {
            batch.close();
        }
        if (allocator != null) {
            try {
                allocator.close();
            } catch (IllegalStateException e) {
                logger.warn("Arrow allocator closed with outstanding memory: {}", e.getMessage());
            }
        }
    }
}
