package com.planprobe.exception;

/**
 * Thrown when a query fails at runtime, after the plan was built.
 *
 * <p>Covers evaluation failures (type coercion that only surfaces on real
 * data), I/O failures while scanning the source and, when a deadline is
 * configured, {@link Kind#TIMEOUT}.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       QueryResult result = runner.execute(session, plan);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 */
public class QueryExecutionException extends PlanProbeException {

    public enum Kind { FAILURE, TIMEOUT }

    private final Kind kind;
    private final String failedSQL;

    public QueryExecutionException(Kind kind, String message, String sql) {
        super(message, EngineMessages.offendingIdentifier(message));
        this.kind = kind;
        this.failedSQL = sql;
    }

    public QueryExecutionException(Kind kind, String message, Throwable cause, String sql) {
        super(message, EngineMessages.offendingIdentifier(message), cause);
        this.kind = kind;
        this.failedSQL = sql;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    @Override
    public Stage getStage() {
        return Stage.EXECUTION;
    }

    @Override
    public String getKindName() {
        return kind.name();
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates the common DuckDB runtime errors into actionable guidance.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (kind == Kind.TIMEOUT) {
            return "Query exceeded its deadline and was cancelled. " +
                   "Raise timeout_ms or narrow the query.";
        }

        String message = getMessage();
        if (message == null) {
            return "Query execution failed.";
        }
        if (message.contains("Conversion Error")) {
            String value = getIdentifier();
            return value != null
                ? "Cannot convert value '" + value + "'. Check that literal types match column types."
                : "Data type mismatch in query. Check that literal types match column types.";
        }
        if (message.contains("Out of Memory Error")) {
            return "Query requires more memory than available. " +
                   "Try adding filters or raising memory_limit.";
        }
        if (message.contains("IO Error")) {
            if (message.contains("No such file") || message.contains("No files found")) {
                return "File not found. Check that the dataset path is correct and the file exists.";
            }
            return "I/O error reading the dataset: " + message;
        }
        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed (").append(kind).append(")\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
