package com.planprobe.execution;

import com.planprobe.config.ExecutionOption;
import com.planprobe.exception.QueryExecutionException;
import com.planprobe.logging.QueryLogger;
import com.planprobe.plan.CompiledPlan;
import com.planprobe.plan.OptimizedLogicalPlan;
import com.planprobe.plan.PhysicalPlan;
import com.planprobe.runtime.ArrowBatchStream;
import com.planprobe.session.QuerySession;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes a compiled query and materializes its complete result.
 *
 * <p>The timer starts immediately before the statement is submitted and stops
 * once the last batch has been copied out of the engine, so the timing covers
 * scan, execution and Arrow export. Failures are reported once and never
 * retried.
 *
 * <p>Example usage:
 * <pre>
 *   try (QueryResult result = new ExecutionRunner().execute(session, physicalPlan)) {
 *       System.out.println(result.totalRows() + " rows in " + result.timing());
 *   }
 * </pre>
 */
public class ExecutionRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionRunner.class);

    /**
     * Executes an optimized logical plan.
     *
     * @param session the session the plan was compiled in
     * @param plan the plan
     * @return the materialized result; the caller must close it
     * @throws QueryExecutionException on runtime failure or deadline expiry
     */
    public QueryResult execute(QuerySession session, OptimizedLogicalPlan plan) {
        return run(session, plan);
    }

    /**
     * Executes a physical plan.
     *
     * @param session the session the plan was compiled in
     * @param plan the plan
     * @return the materialized result; the caller must close it
     * @throws QueryExecutionException on runtime failure or deadline expiry
     */
    public QueryResult execute(QuerySession session, PhysicalPlan plan) {
        return run(session, plan);
    }

    private QueryResult run(QuerySession session, CompiledPlan plan) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(plan, "plan must not be null");

        String sql = plan.sql();
        int batchSize = session.options().effectiveBatchSize();
        long timeoutMs = session.options().getInt(ExecutionOption.TIMEOUT_MS);

        String queryId = QueryLogger.newQueryId();
        QueryLogger.startQuery(queryId, "execute", sql);

        BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        List<RowBatch> batches = new ArrayList<>();
        QueryDeadline deadline = null;
        try (DuckDBConnection conn = session.openConnection()) {
            Statement stmt = conn.createStatement();
            deadline = QueryDeadline.start(stmt, timeoutMs);

            long start = System.nanoTime();
            ResultSet rs;
            try {
                rs = stmt.executeQuery(sql);
            } catch (SQLException e) {
                stmt.close();
                throw e;
            }

            Schema schema;
            try (ArrowBatchStream stream = ArrowBatchStream.export(rs, stmt, allocator, batchSize)) {
                while (stream.loadNext()) {
                    batches.add(RowBatch.copyOf(stream.current(), allocator));
                }
                schema = stream.schema();
                logger.debug("Exported {} rows in {} batches", stream.rowCount(), stream.batchCount());
            }
            Timing timing = Timing.ofNanos(System.nanoTime() - start);

            QueryResult result = new QueryResult(sql, schema, batches, timing, allocator);
            QueryLogger.logExecution(timing.toMillis(), result.totalRows(), batches.size());
            return result;

        } catch (SQLException | RuntimeException e) {
            release(batches, allocator);
            QueryLogger.logError(e);
            if (deadline != null && deadline.expired()) {
                throw new QueryExecutionException(QueryExecutionException.Kind.TIMEOUT,
                    "Query cancelled after " + timeoutMs + " ms deadline", e, sql);
            }
            throw new QueryExecutionException(QueryExecutionException.Kind.FAILURE,
                "Failed to execute query: " + e.getMessage(), e, sql);
        } finally {
            if (deadline != null) {
                deadline.close();
            }
            QueryLogger.clearContext();
        }
    }

    private void release(List<RowBatch> batches, BufferAllocator allocator) {
        batches.forEach(RowBatch::close);
        try {
            allocator.close();
        } catch (IllegalStateException e) {
            logger.warn("Arrow allocator closed with outstanding memory: {}", e.getMessage());
        }
    }
}
