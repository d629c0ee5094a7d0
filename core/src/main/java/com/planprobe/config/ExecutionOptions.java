package com.planprobe.config;

import com.planprobe.exception.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable, validated set of execution options.
 *
 * <p>Options are validated when built: an unrecognized key or a value of the
 * wrong type fails with {@link ConfigException} before any session exists.
 *
 * <p>Example usage:
 * <pre>
 *   ExecutionOptions options = ExecutionOptions.build(Map.of(
 *       "pushdown_filters", true,
 *       "reorder_filters", false));
 *
 *   try (QuerySession session = QuerySession.create(options)) {
 *       ...
 *   }
 * </pre>
 */
public final class ExecutionOptions {

    /** Prefix of JVM system properties that override option defaults. */
    public static final String SYSTEM_PROPERTY_PREFIX = "planprobe.option.";

    public static final int MIN_BATCH_SIZE = 1024;
    public static final int MAX_BATCH_SIZE = 65536;

    // DuckDB size literal: a number with an optional byte unit, e.g. 512MB, 1.5GiB
    private static final Pattern MEMORY_LIMIT_PATTERN = Pattern.compile(
        "\\s*\\d+(\\.\\d+)?\\s*(b|bytes?|k|kb|kib|kilobytes?|m|mb|mib|megabytes?"
            + "|g|gb|gib|gigabytes?|t|tb|tib|terabytes?)?\\s*",
        Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> OPTION_BY_ENGINE_SETTING = Map.of(
        "enable_object_cache", ExecutionOption.ENABLE_PAGE_INDEX.key(),
        "threads", ExecutionOption.THREADS.key(),
        "memory_limit", ExecutionOption.MEMORY_LIMIT.key());

    private static final ExecutionOptions DEFAULTS = new ExecutionOptions(new EnumMap<>(ExecutionOption.class));

    private final Map<ExecutionOption, Object> explicit;

    private ExecutionOptions(EnumMap<ExecutionOption, Object> explicit) {
        this.explicit = Collections.unmodifiableMap(explicit);
    }

    /**
     * Returns the options with every value at its default.
     *
     * @return default options
     */
    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Builds options from a key/value mapping.
     *
     * @param options option values keyed by option name
     * @return the validated options
     * @throws ConfigException if a key is unrecognized or a value has the wrong type
     */
    public static ExecutionOptions build(Map<String, ?> options) {
        Objects.requireNonNull(options, "options must not be null");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            builder.set(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Builds options from {@code planprobe.option.<key>} system properties.
     *
     * <p>Property values are converted with {@link #parseValue(String)}.
     *
     * @return the validated options
     * @throws ConfigException if a property names an unrecognized option or has the wrong type
     */
    public static ExecutionOptions fromSystemProperties() {
        Builder builder = builder();
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                String key = name.substring(SYSTEM_PROPERTY_PREFIX.length());
                builder.set(key, parseValue(System.getProperty(name)));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converts command-line text into a scalar option value.
     *
     * <p>{@code true}/{@code false} (any case) become booleans, integral text
     * becomes an integer, anything else stays a string.
     *
     * @param text the raw text
     * @return the scalar value
     */
    public static Object parseValue(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(trimmed);
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return trimmed;
        }
    }

    /**
     * Returns the effective value of an option.
     *
     * @param option the option
     * @return the explicit value, else the default (null when the engine default applies)
     */
    public Object get(ExecutionOption option) {
        Object value = explicit.get(option);
        return value != null ? value : option.defaultValue();
    }

    public boolean getBoolean(ExecutionOption option) {
        requireType(option, OptionType.BOOLEAN);
        return (Boolean) get(option);
    }

    public int getInt(ExecutionOption option) {
        requireType(option, OptionType.INTEGER);
        Object value = get(option);
        if (value == null) {
            throw new IllegalStateException("Option '" + option.key() + "' has no value");
        }
        return (Integer) value;
    }

    public String getString(ExecutionOption option) {
        requireType(option, OptionType.STRING);
        return (String) get(option);
    }

    /**
     * True if the option was set explicitly rather than defaulted.
     *
     * @param option the option
     * @return true if explicitly set
     */
    public boolean isExplicit(ExecutionOption option) {
        return explicit.containsKey(option);
    }

    /**
     * Returns every effective value keyed by option name, in vocabulary order.
     *
     * <p>Options without a value (engine default) are omitted.
     *
     * @return unmodifiable map of option name to value
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (ExecutionOption option : ExecutionOption.values()) {
            Object value = get(option);
            if (value != null) {
                map.put(option.key(), value);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Rows per exported Arrow batch, clamped to
     * [{@value #MIN_BATCH_SIZE}, {@value #MAX_BATCH_SIZE}].
     *
     * @return the batch size the Arrow export is asked for
     */
    public int effectiveBatchSize() {
        int requested = getInt(ExecutionOption.BATCH_SIZE);
        if (requested == 0) {
            return (Integer) ExecutionOption.BATCH_SIZE.defaultValue();
        }
        return Math.max(MIN_BATCH_SIZE, Math.min(MAX_BATCH_SIZE, requested));
    }

    /**
     * Returns the DuckDB optimizer names disabled by these options.
     *
     * @return optimizer names in vocabulary order
     */
    public List<String> disabledOptimizers() {
        List<String> disabled = new ArrayList<>();
        if (!getBoolean(ExecutionOption.PRUNING)) {
            disabled.add("statistics_propagation");
        }
        if (!getBoolean(ExecutionOption.PUSHDOWN_FILTERS)) {
            disabled.add("filter_pushdown");
        }
        if (!getBoolean(ExecutionOption.REORDER_FILTERS)) {
            disabled.add("reorder_filter");
        }
        return disabled;
    }

    /**
     * Returns the DuckDB statements that apply these options to a connection.
     *
     * <p>The list is deterministic: same options, same statements, same order.
     *
     * @return the {@code SET} statements
     */
    public List<String> engineSettings() {
        List<String> statements = new ArrayList<>();
        List<String> disabled = disabledOptimizers();
        if (!disabled.isEmpty()) {
            statements.add("SET disabled_optimizers = '" + String.join(",", disabled) + "'");
        }
        statements.add("SET enable_object_cache = " + getBoolean(ExecutionOption.ENABLE_PAGE_INDEX));
        Object threads = get(ExecutionOption.THREADS);
        if (threads != null) {
            statements.add("SET threads = " + threads);
        }
        String memoryLimit = getString(ExecutionOption.MEMORY_LIMIT);
        if (memoryLimit != null) {
            statements.add("SET memory_limit = '" + memoryLimit.replace("'", "''") + "'");
        }
        return statements;
    }

    /**
     * Names the option behind one of the statements of {@link #engineSettings()}.
     *
     * @param statement a {@code SET name = value} statement
     * @return the option key, or the engine setting name when several options feed it
     */
    public static String optionForSetting(String statement) {
        String body = statement.trim();
        if (body.regionMatches(true, 0, "SET ", 0, 4)) {
            body = body.substring(4);
        }
        int eq = body.indexOf('=');
        String setting = (eq < 0 ? body : body.substring(0, eq)).trim();
        return OPTION_BY_ENGINE_SETTING.getOrDefault(setting, setting);
    }

    private static void requireType(ExecutionOption option, OptionType expected) {
        if (option.type() != expected) {
            throw new IllegalArgumentException(
                "Option '%s' is %s, not %s".formatted(option.key(), option.type(), expected));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionOptions)) return false;
        return asMap().equals(((ExecutionOptions) o).asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "ExecutionOptions" + asMap();
    }

    /**
     * Accumulates option values; validation happens on every {@link #set} call.
     */
    public static final class Builder {

        private final EnumMap<ExecutionOption, Object> values = new EnumMap<>(ExecutionOption.class);

        private Builder() {}

        /**
         * Sets an option by key.
         *
         * @param key the option key
         * @param value the scalar value
         * @return this builder
         * @throws ConfigException if the key is unrecognized or the value has the wrong type
         */
        public Builder set(String key, Object value) {
            ExecutionOption option = ExecutionOption.fromKey(key)
                .orElseThrow(() -> ConfigException.unknownOption(key));
            return set(option, value);
        }

        /**
         * Sets an option.
         *
         * @param option the option
         * @param value the scalar value
         * @return this builder
         * @throws ConfigException if the value has the wrong type or is out of range
         */
        public Builder set(ExecutionOption option, Object value) {
            Object coerced = option.type().coerce(value);
            if (coerced == null) {
                throw ConfigException.typeMismatch(option.key(), option.type().name(), value);
            }
            if (coerced instanceof Integer i) {
                int minimum = option == ExecutionOption.THREADS ? 1 : 0;
                if (i < minimum) {
                    throw ConfigException.typeMismatch(option.key(), "INTEGER >= " + minimum, value);
                }
            }
            if (option == ExecutionOption.MEMORY_LIMIT
                    && !MEMORY_LIMIT_PATTERN.matcher((String) coerced).matches()) {
                throw ConfigException.typeMismatch(option.key(), "a memory size such as '512MB' or '2GiB'", value);
            }
            values.put(option, coerced);
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(new EnumMap<>(values));
        }
    }
}
