package com.planprobe.exception;

/**
 * Thrown when execution options cannot be built.
 */
public class ConfigException extends PlanProbeException {

    public enum Kind { UNKNOWN_OPTION, TYPE_MISMATCH, ENGINE_REJECTED }

    private final Kind kind;

    public ConfigException(Kind kind, String optionName, String message) {
        super(message, optionName);
        this.kind = kind;
    }

    public ConfigException(Kind kind, String optionName, String message, Throwable cause) {
        super(message, optionName, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Stage getStage() {
        return Stage.CONFIGURATION;
    }

    @Override
    public String getKindName() {
        return kind.name();
    }

    public static ConfigException unknownOption(String name) {
        return new ConfigException(Kind.UNKNOWN_OPTION, name, "Unrecognized option: " + name);
    }

    public static ConfigException typeMismatch(String name, String expected, Object actual) {
        String actualType = actual == null ? "null" : actual.getClass().getSimpleName();
        return new ConfigException(Kind.TYPE_MISMATCH, name,
            "Option '%s' expects %s but got %s (%s)".formatted(name, expected, actualType, actual));
    }

    public static ConfigException engineRejected(String name, String setting, Throwable cause) {
        return new ConfigException(Kind.ENGINE_REJECTED, name,
            "Engine rejected '%s': %s".formatted(setting, cause.getMessage()), cause);
    }
}
