package com.planprobe.explain;

import java.util.Objects;

/**
 * One (stage name, stage text) row reported by EXPLAIN ANALYZE.
 *
 * @param stageName the engine's key, e.g. {@code analyzed_plan}
 * @param stageText the rendered plan with runtime metrics
 */
public record ExplainRecord(String stageName, String stageText) {

    public ExplainRecord {
        Objects.requireNonNull(stageName, "stageName must not be null");
        Objects.requireNonNull(stageText, "stageText must not be null");
    }

    @Override
    public String toString() {
        return stageName + ": " + stageText;
    }
}
