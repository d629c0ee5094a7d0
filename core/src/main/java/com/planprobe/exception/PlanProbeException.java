package com.planprobe.exception;

/**
 * Base class for every failure the probe pipeline reports.
 *
 * <p>Each exception knows the pipeline {@link Stage} it was raised in and,
 * where one exists, the offending identifier (an option name, relation name,
 * column, table or SQL token). The command line prints both before exiting
 * with a non-zero status.
 *
 * <p>Exceptions are never retried by the pipeline: the first failure of a
 * stage is surfaced verbatim to the caller.
 */
public abstract class PlanProbeException extends RuntimeException {

    /**
     * Pipeline stages, in the order the error taxonomy lists them.
     */
    public enum Stage {
        CONFIGURATION,
        REGISTRATION,
        PARSE,
        OPTIMIZE,
        PLANNING,
        EXECUTION,
        DISPLAY
    }

    private final String identifier;

    protected PlanProbeException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    protected PlanProbeException(String message, String identifier, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    /**
     * Returns the stage that failed.
     *
     * @return the failing stage
     */
    public abstract Stage getStage();

    /**
     * Returns the short name of the error kind, e.g. {@code UNKNOWN_OPTION}.
     *
     * @return the kind name
     */
    public abstract String getKindName();

    /**
     * Returns the offending identifier.
     *
     * @return the identifier, or null if the engine did not name one
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Returns the one-line description printed to the error stream.
     *
     * @return formatted summary of stage, kind, identifier and message
     */
    public String toReportLine() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stage ").append(getStage()).append(" failed: ").append(getKindName());
        if (identifier != null) {
            sb.append(" '").append(identifier).append('\'');
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
