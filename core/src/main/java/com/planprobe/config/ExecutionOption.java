package com.planprobe.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * The recognized execution option vocabulary.
 *
 * <p>The first four options control how the engine treats filters on the
 * scanned Parquet data; the rest tune execution of the probe itself.
 * Boolean pushdown options default to {@code true}.
 */
public enum ExecutionOption {

    /** Statistics-based pruning of filters and row groups. */
    PRUNING("pruning", OptionType.BOOLEAN, Boolean.TRUE),

    /** Parquet footer and page metadata caching. */
    ENABLE_PAGE_INDEX("enable_page_index", OptionType.BOOLEAN, Boolean.TRUE),

    /** Push filter predicates into the Parquet scan. */
    PUSHDOWN_FILTERS("pushdown_filters", OptionType.BOOLEAN, Boolean.TRUE),

    /** Reorder conjunctive filters by estimated cost. */
    REORDER_FILTERS("reorder_filters", OptionType.BOOLEAN, Boolean.TRUE),

    /** Engine worker threads; engine default when unset. */
    THREADS("threads", OptionType.INTEGER, null),

    /** Engine memory limit such as {@code 2GB}; engine default when unset. */
    MEMORY_LIMIT("memory_limit", OptionType.STRING, null),

    /** Rows per exported Arrow batch. */
    BATCH_SIZE("batch_size", OptionType.INTEGER, 8192),

    /** Execution deadline in milliseconds; 0 disables it. */
    TIMEOUT_MS("timeout_ms", OptionType.INTEGER, 0);

    private final String key;
    private final OptionType type;
    private final Object defaultValue;

    ExecutionOption(String key, OptionType type, Object defaultValue) {
        this.key = key;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String key() {
        return key;
    }

    public OptionType type() {
        return type;
    }

    /**
     * Returns the default value.
     *
     * @return the default, or null when the engine's own default applies
     */
    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * Looks up an option by its key.
     *
     * @param key the option key, e.g. {@code pushdown_filters}
     * @return the option, or empty if the key is not recognized
     */
    public static Optional<ExecutionOption> fromKey(String key) {
        return Arrays.stream(values())
            .filter(option -> option.key.equals(key))
            .findFirst();
    }
}
