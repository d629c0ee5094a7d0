package com.planprobe.exception;

/**
 * Thrown when a relation cannot be bound into a session.
 *
 * <p>{@link Kind#SOURCE_UNAVAILABLE} always carries the collaborator's
 * failure as its cause.
 */
public class RegistrationException extends PlanProbeException {

    public enum Kind { DUPLICATE_NAME, INVALID_NAME, SOURCE_UNAVAILABLE }

    private final Kind kind;

    public RegistrationException(Kind kind, String relationName, String message) {
        super(message, relationName);
        this.kind = kind;
    }

    public RegistrationException(Kind kind, String relationName, String message, Throwable cause) {
        super(message, relationName, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Stage getStage() {
        return Stage.REGISTRATION;
    }

    @Override
    public String getKindName() {
        return kind.name();
    }
}
