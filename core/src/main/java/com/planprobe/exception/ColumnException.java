package com.planprobe.exception;

/**
 * Thrown by the result inspector when a column cannot be previewed.
 */
public class ColumnException extends PlanProbeException {

    public enum Kind { NOT_FOUND }

    private final Kind kind;

    public ColumnException(Kind kind, String column, String message) {
        super(message, column);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Stage getStage() {
        return Stage.DISPLAY;
    }

    @Override
    public String getKindName() {
        return kind.name();
    }
}
