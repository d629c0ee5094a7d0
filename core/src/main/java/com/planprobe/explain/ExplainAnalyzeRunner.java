package com.planprobe.explain;

import com.planprobe.config.ExecutionOption;
import com.planprobe.exception.EngineMessages;
import com.planprobe.exception.PlanCompilationException;
import com.planprobe.exception.QueryExecutionException;
import com.planprobe.execution.QueryDeadline;
import com.planprobe.logging.QueryLogger;
import com.planprobe.plan.SqlStatements;
import com.planprobe.session.QuerySession;
import org.duckdb.DuckDBConnection;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a statement under EXPLAIN ANALYZE and returns the annotated plan.
 *
 * <p>The statement really executes, so the engine reports actual row counts
 * and operator timings. This runner shares nothing with the
 * {@link com.planprobe.execution.ExecutionRunner} except the session: it opens
 * its own connection and reads the two-column explain result through plain
 * JDBC, keeping the rows in the order the engine returned them.
 */
public class ExplainAnalyzeRunner {

    static final String EXPLAIN_ANALYZE_PREFIX = "EXPLAIN ANALYZE ";

    /**
     * Executes {@code EXPLAIN ANALYZE <sql>}.
     *
     * @param session the session holding the referenced relations
     * @param sql one SQL statement
     * @return the explain records in engine order
     * @throws PlanCompilationException if the statement does not parse or bind
     * @throws QueryExecutionException on runtime failure or deadline expiry
     */
    public List<ExplainRecord> explainAnalyze(QuerySession session, String sql) {
        Objects.requireNonNull(session, "session must not be null");

        String statement;
        try {
            statement = SqlStatements.singleStatement(sql);
        } catch (IllegalArgumentException e) {
            throw new PlanCompilationException(PlanCompilationException.Phase.PARSE, e.getMessage(), ";", sql, e);
        }
        String explainSql = EXPLAIN_ANALYZE_PREFIX + statement;
        long timeoutMs = session.options().getInt(ExecutionOption.TIMEOUT_MS);

        QueryLogger.startQuery(QueryLogger.newQueryId(), "explain_analyze", statement);
        QueryDeadline deadline = null;
        long start = System.nanoTime();
        try (DuckDBConnection conn = session.openConnection();
             Statement stmt = conn.createStatement()) {
            deadline = QueryDeadline.start(stmt, timeoutMs);

            List<ExplainRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery(explainSql)) {
                while (rs.next()) {
                    records.add(new ExplainRecord(rs.getString(1), rs.getString(2)));
                }
            }
            QueryLogger.logExplain(records.size(), (System.nanoTime() - start) / 1_000_000.0);
            return List.copyOf(records);

        } catch (SQLException e) {
            QueryLogger.logError(e);
            String message = e.getMessage();
            if (deadline != null && deadline.expired()) {
                throw new QueryExecutionException(QueryExecutionException.Kind.TIMEOUT,
                    "Explain analyze cancelled after " + timeoutMs + " ms deadline", e, explainSql);
            }
            if (EngineMessages.isCompileTimeError(message)) {
                throw new PlanCompilationException(PlanCompilationException.Phase.PARSE, message,
                    EngineMessages.offendingIdentifier(message), statement, e);
            }
            throw new QueryExecutionException(QueryExecutionException.Kind.FAILURE,
                "Failed to run explain analyze: " + message, e, explainSql);
        } finally {
            if (deadline != null) {
                deadline.close();
            }
            QueryLogger.clearContext();
        }
    }
}
