package com.planprobe.pipeline;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.execution.ExecutionRunner;
import com.planprobe.execution.QueryResult;
import com.planprobe.execution.Timing;
import com.planprobe.explain.ExplainAnalyzeRunner;
import com.planprobe.explain.ExplainRecord;
import com.planprobe.explain.PlanShapeCheck;
import com.planprobe.inspect.PreviewRow;
import com.planprobe.inspect.ResultInspector;
import com.planprobe.plan.LogicalPlan;
import com.planprobe.plan.OptimizedLogicalPlan;
import com.planprobe.plan.PhysicalPlan;
import com.planprobe.plan.PlanCompiler;
import com.planprobe.session.QuerySession;
import com.planprobe.session.RelationBinding;
import com.planprobe.source.ParquetSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs one complete probe: configure, register, explain analyze, compile,
 * execute, preview.
 *
 * <p>Stages run sequentially and fail fast: the first exception aborts the run
 * and propagates unchanged. Explain analyze and the execution run are two
 * independent executions that share only the session; their row counts and
 * timings are not required to agree, only their plan shape is compared.
 *
 * <p>Without an explicit preview column the first string or binary column is
 * previewed. A result with none skips the preview instead of failing.
 */
public class ProbePipeline {

    private static final Logger logger = LoggerFactory.getLogger(ProbePipeline.class);

    static final String PREVIEW_SKIPPED_REASON = "result has no string or binary column";

    private final PlanCompiler compiler;
    private final ExecutionRunner executionRunner;
    private final ExplainAnalyzeRunner explainRunner;
    private final ResultInspector inspector;

    public ProbePipeline() {
        this(new PlanCompiler(), new ExecutionRunner(), new ExplainAnalyzeRunner(), new ResultInspector());
    }

    public ProbePipeline(PlanCompiler compiler,
                         ExecutionRunner executionRunner,
                         ExplainAnalyzeRunner explainRunner,
                         ResultInspector inspector) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.executionRunner = Objects.requireNonNull(executionRunner, "executionRunner must not be null");
        this.explainRunner = Objects.requireNonNull(explainRunner, "explainRunner must not be null");
        this.inspector = Objects.requireNonNull(inspector, "inspector must not be null");
    }

    /**
     * Runs a probe.
     *
     * @param request the probe request
     * @param listener receives each artifact once its stage completed
     * @return the report
     * @throws com.planprobe.exception.PlanProbeException from the first failing stage
     */
    public ProbeReport run(ProbeRequest request, ProbeListener listener) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        ExecutionOptions options = ExecutionOptions.build(request.options());
        logger.info("Starting probe of {} with options {}", request.dataPath(), options.asMap());

        try (QuerySession session = QuerySession.create(options)) {
            RelationBinding binding = session.register(request.tableName(), new ParquetSource(request.dataPath()));
            listener.onRegistered(binding);

            List<ExplainRecord> records = List.of();
            if (request.explainAnalyze()) {
                records = explainRunner.explainAnalyze(session, request.sql());
                listener.onExplainAnalyze(records);
            }

            LogicalPlan logical = compiler.compile(session, request.sql());
            OptimizedLogicalPlan optimized = compiler.optimize(session, logical);
            PhysicalPlan physical = compiler.physicalize(session, optimized);

            long totalRows;
            String column;
            List<PreviewRow> preview;
            Timing timing;
            try (QueryResult result = executionRunner.execute(session, physical)) {
                totalRows = result.totalRows();
                timing = result.timing();
                listener.onExecuted(totalRows, result.batches().size(), timing);

                column = request.previewColumn() != null
                    ? request.previewColumn()
                    : inspector.firstDisplayableColumn(result.schema()).orElse(null);
                if (column != null) {
                    preview = inspector.preview(result, column, request.maxRows(), request.maxValueLength());
                    listener.onPreview(column, preview);
                } else {
                    preview = List.of();
                    logger.info("No string or binary column in {}, preview skipped", result.schema().getFields());
                    listener.onPreviewSkipped(PREVIEW_SKIPPED_REASON);
                }
            }

            listener.onPlan(logical);
            listener.onPlan(optimized);
            listener.onPlan(physical);

            List<String> missing = List.of();
            if (request.explainAnalyze()) {
                missing = PlanShapeCheck.missingOperators(physical, records);
                if (!missing.isEmpty()) {
                    logger.warn("Analyzed plan lacks physical operators {}", missing);
                }
                listener.onShapeCheck(missing);
            }

            return new ProbeReport(records, logical, optimized, physical, totalRows, timing,
                column, preview, missing);
        }
    }
}
