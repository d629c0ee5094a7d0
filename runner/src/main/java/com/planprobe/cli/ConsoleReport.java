package com.planprobe.cli;

import com.planprobe.execution.Timing;
import com.planprobe.explain.ExplainRecord;
import com.planprobe.inspect.PreviewRow;
import com.planprobe.pipeline.ProbeListener;
import com.planprobe.plan.CompiledPlan;
import com.planprobe.session.RelationBinding;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints probe artifacts to a stream as each stage completes.
 */
public class ConsoleReport implements ProbeListener {

    static final String HEAVY_RULE = "=".repeat(60);
    static final String LIGHT_RULE = "-".repeat(60);

    private final PrintStream out;

    public ConsoleReport(PrintStream out) {
        this.out = out;
    }

    public void printBanner(String dataPath, String sql) {
        out.println(HEAVY_RULE);
        out.println("PlanProbe");
        out.println("Data Path: " + dataPath);
        out.println("Query: " + sql);
        out.println(HEAVY_RULE);
    }

    @Override
    public void onRegistered(RelationBinding binding) {
        out.println("Registered '" + binding.name() + "': "
            + binding.schema().size() + " columns, "
            + binding.statistics().fileCount() + " files, "
            + binding.statistics().rowGroupCount() + " row groups, "
            + binding.statistics().rowCount() + " rows");
    }

    @Override
    public void onExplainAnalyze(List<ExplainRecord> records) {
        out.println();
        out.println("EXPLAIN ANALYZE");
        out.println(LIGHT_RULE);
        for (ExplainRecord record : records) {
            out.println(record.stageName() + ": " + record.stageText());
        }
    }

    @Override
    public void onExecuted(long totalRows, int batchCount, Timing timing) {
        out.println();
        out.println(HEAVY_RULE);
        out.println("Query executed in: " + timing.format());
        out.println("Total rows returned: " + totalRows);
        out.println(HEAVY_RULE);
    }

    @Override
    public void onPreview(String column, List<PreviewRow> rows) {
        out.println();
        out.println("First " + rows.size() + " values of '" + column + "':");
        out.println(LIGHT_RULE);
        for (PreviewRow row : rows) {
            out.println("Row " + (row.rowIndex() + 1) + ": " + row.text());
        }
    }

    @Override
    public void onPreviewSkipped(String reason) {
        out.println();
        out.println("Preview skipped: " + reason);
    }

    @Override
    public void onPlan(CompiledPlan plan) {
        out.println();
        out.println(plan.stage().title() + ":");
        out.println(LIGHT_RULE);
        out.println(plan.render());
    }

    @Override
    public void onShapeCheck(List<String> missingOperators) {
        out.println();
        if (missingOperators.isEmpty()) {
            out.println("Analyzed plan matches physical plan shape");
        } else {
            out.println("Analyzed plan is missing operators: " + String.join(", ", missingOperators));
        }
    }
}
