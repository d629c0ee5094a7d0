package com.planprobe.pipeline;

import com.planprobe.execution.Timing;
import com.planprobe.explain.ExplainRecord;
import com.planprobe.inspect.PreviewRow;
import com.planprobe.plan.LogicalPlan;
import com.planprobe.plan.OptimizedLogicalPlan;
import com.planprobe.plan.PhysicalPlan;

import java.util.List;

/**
 * Artifacts of a completed probe run.
 *
 * @param explainRecords explain analyze output; empty when it was skipped
 * @param logicalPlan the unoptimized logical plan
 * @param optimizedPlan the optimized logical plan
 * @param physicalPlan the physical plan
 * @param totalRows rows returned by the execution run
 * @param timing duration of the execution run
 * @param previewColumn the previewed column; null when the preview was skipped
 * @param preview the previewed values
 * @param missingOperators physical operators absent from the analyzed plan; empty when consistent
 */
public record ProbeReport(List<ExplainRecord> explainRecords,
                          LogicalPlan logicalPlan,
                          OptimizedLogicalPlan optimizedPlan,
                          PhysicalPlan physicalPlan,
                          long totalRows,
                          Timing timing,
                          String previewColumn,
                          List<PreviewRow> preview,
                          List<String> missingOperators) {

    public ProbeReport {
        explainRecords = List.copyOf(explainRecords);
        preview = List.copyOf(preview);
        missingOperators = List.copyOf(missingOperators);
    }

    public boolean previewSkipped() {
        return previewColumn == null;
    }
}
