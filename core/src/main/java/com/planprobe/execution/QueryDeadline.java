package com.planprobe.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancels a running statement once its deadline passes.
 *
 * <p>A deadline of zero never fires. Callers check {@link #expired()} when the
 * statement fails, to report a timeout rather than a generic failure.
 *
 * <pre>{@code
 * try (QueryDeadline deadline = QueryDeadline.start(stmt, timeoutMs)) {
 *     ... run the statement ...
 * } catch (SQLException e) {
 *     if (deadline.expired()) { ... }
 * }
 * }</pre>
 */
public final class QueryDeadline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryDeadline.class);

    private final ScheduledExecutorService watchdog;
    private final ScheduledFuture<?> task;
    private final AtomicBoolean expired = new AtomicBoolean(false);
    private final long timeoutMs;

    private QueryDeadline(Statement statement, long timeoutMs) {
        this.timeoutMs = timeoutMs;
        if (timeoutMs <= 0) {
            this.watchdog = null;
            this.task = null;
            return;
        }
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "query-deadline");
            t.setDaemon(true);
            return t;
        });
        this.task = watchdog.schedule(() -> cancel(statement), timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Starts the deadline clock for a statement.
     *
     * @param statement statement to cancel on expiry
     * @param timeoutMs deadline in milliseconds; 0 disables it
     * @return the deadline; close it once the statement is done
     */
    public static QueryDeadline start(Statement statement, long timeoutMs) {
        return new QueryDeadline(statement, timeoutMs);
    }

    private void cancel(Statement statement) {
        expired.set(true);
        logger.warn("Query exceeded deadline of {} ms, cancelling", timeoutMs);
        try {
            statement.cancel();
        } catch (SQLException e) {
            logger.warn("Failed to cancel statement: {}", e.getMessage());
        }
    }

    public boolean expired() {
        return expired.get();
    }

    @Override
    public void close() {
        if (task != null) {
            task.cancel(false);
            watchdog.shutdownNow();
        }
    }
}
