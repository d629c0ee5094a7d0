package com.planprobe.config;

/**
 * Scalar types an execution option may carry.
 */
public enum OptionType {
    BOOLEAN,
    INTEGER,
    STRING;

    /**
     * Checks a raw value against this type and normalizes it.
     *
     * @param value the raw value
     * @return the normalized value ({@code Boolean}, {@code Integer} or {@code String}),
     *         or null if the value does not match this type
     */
    Object coerce(Object value) {
        switch (this) {
            case BOOLEAN:
                return value instanceof Boolean ? value : null;
            case INTEGER:
                if (value instanceof Integer) {
                    return value;
                }
                if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                    return l.intValue();
                }
                return null;
            case STRING:
                return value instanceof String ? value : null;
            default:
                throw new IllegalStateException("Unhandled option type: " + this);
        }
    }
}
