package com.planprobe.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured per-query logging.
 *
 * <p>Each submitted statement gets a short correlation id that is placed in
 * the SLF4J {@link MDC} under {@value #QUERY_ID_KEY}, so every log line
 * emitted while the query runs can be attributed to it. Callers must pair
 * {@link #startQuery} with {@link #clearContext()} in a {@code finally} block.
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    public static final String QUERY_ID_KEY = "queryId";
    public static final String QUERY_KIND_KEY = "queryKind";

    private QueryLogger() {}

    /**
     * Generates a new correlation id.
     *
     * @return id of the form {@code q_xxxxxxxx}
     */
    public static String newQueryId() {
        return "q_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static void startQuery(String queryId, String kind, String sql) {
        MDC.put(QUERY_ID_KEY, queryId);
        MDC.put(QUERY_KIND_KEY, kind);
        if (logger.isDebugEnabled()) {
            logger.debug("Starting {} query: {}", kind, abbreviate(sql));
        }
    }

    public static void logExecution(double elapsedMs, long rowCount, int batchCount) {
        logger.info("Query completed in {} ms: {} rows in {} batches",
            String.format("%.3f", elapsedMs), rowCount, batchCount);
    }

    public static void logExplain(int recordCount, double elapsedMs) {
        logger.info("Explain analyze returned {} records in {} ms",
            recordCount, String.format("%.3f", elapsedMs));
    }

    public static void logError(Exception e) {
        logger.error("Query failed: {}", e.getMessage());
        logger.debug("Query failure detail", e);
    }

    public static void clearContext() {
        MDC.remove(QUERY_ID_KEY);
        MDC.remove(QUERY_KIND_KEY);
    }

    /**
     * Shortens SQL for log lines.
     *
     * @param sql the SQL text
     * @return the first 100 characters, single-lined
     */
    public static String abbreviate(String sql) {
        if (sql == null) {
            return null;
        }
        String flat = sql.replaceAll("\\s+", " ").trim();
        return flat.length() > 100 ? flat.substring(0, 100) + "..." : flat;
    }
}
