package com.planprobe.exception;

/**
 * Thrown by the plan compiler before any data is read.
 *
 * <p>The {@link Phase} distinguishes parse/bind failures from failures while
 * deriving the optimized logical plan or the physical plan.
 */
public class PlanCompilationException extends PlanProbeException {

    public enum Phase {
        PARSE(Stage.PARSE),
        OPTIMIZE(Stage.OPTIMIZE),
        PLANNING(Stage.PLANNING);

        private final Stage stage;

        Phase(Stage stage) {
            this.stage = stage;
        }

        public Stage stage() {
            return stage;
        }
    }

    private final Phase phase;
    private final String sql;

    public PlanCompilationException(Phase phase, String message, String identifier, String sql) {
        super(message, identifier);
        this.phase = phase;
        this.sql = sql;
    }

    public PlanCompilationException(Phase phase, String message, String identifier, String sql, Throwable cause) {
        super(message, identifier, cause);
        this.phase = phase;
        this.sql = sql;
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Returns the SQL that failed to compile.
     *
     * @return the SQL text
     */
    public String getSql() {
        return sql;
    }

    @Override
    public Stage getStage() {
        return phase.stage();
    }

    @Override
    public String getKindName() {
        return phase.name() + "_ERROR";
    }
}
