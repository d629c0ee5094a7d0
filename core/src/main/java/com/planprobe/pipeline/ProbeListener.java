package com.planprobe.pipeline;

import com.planprobe.execution.Timing;
import com.planprobe.explain.ExplainRecord;
import com.planprobe.inspect.PreviewRow;
import com.planprobe.plan.CompiledPlan;
import com.planprobe.session.RelationBinding;

import java.util.List;

/**
 * Receives each artifact as soon as its stage has completed.
 *
 * <p>A stage that fails never reaches its callback, so listeners only ever
 * see complete artifacts.
 */
public interface ProbeListener {

    ProbeListener NONE = new ProbeListener() {};

    default void onRegistered(RelationBinding binding) {}

    default void onExplainAnalyze(List<ExplainRecord> records) {}

    default void onExecuted(long totalRows, int batchCount, Timing timing) {}

    default void onPreview(String column, List<PreviewRow> rows) {}

    default void onPreviewSkipped(String reason) {}

    default void onPlan(CompiledPlan plan) {}

    default void onShapeCheck(List<String> missingOperators) {}
}
