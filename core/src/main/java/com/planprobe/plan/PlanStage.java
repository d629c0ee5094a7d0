package com.planprobe.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Compilation stages, keyed by the names DuckDB uses in EXPLAIN output.
 */
public enum PlanStage {
    LOGICAL("logical_plan", "Logical Plan"),
    OPTIMIZED_LOGICAL("logical_opt", "Optimized Logical Plan"),
    PHYSICAL("physical_plan", "Physical Plan");

    private final String engineKey;
    private final String title;

    PlanStage(String engineKey, String title) {
        this.engineKey = engineKey;
        this.title = title;
    }

    public String engineKey() {
        return engineKey;
    }

    public String title() {
        return title;
    }

    public static Optional<PlanStage> fromEngineKey(String key) {
        return Arrays.stream(values())
            .filter(stage -> stage.engineKey.equals(key))
            .findFirst();
    }
}
