package com.planprobe.execution;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.PlanProbeException;
import com.planprobe.exception.QueryExecutionException;
import com.planprobe.plan.OptimizedLogicalPlan;
import com.planprobe.plan.PhysicalPlan;
import com.planprobe.plan.PlanCompiler;
import com.planprobe.session.QuerySession;
import com.planprobe.source.ParquetSource;
import com.planprobe.test.RunsDataset;
import com.planprobe.test.TestBase;
import com.planprobe.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("ExecutionRunner Tests")
public class ExecutionRunnerTest extends TestBase {

    @TempDir
    Path tempDir;

    private final PlanCompiler compiler = new PlanCompiler();
    private final ExecutionRunner runner = new ExecutionRunner();

    private QuerySession openSession(Map<String, ?> options) throws SQLException {
        Path file = RunsDataset.write(tempDir);
        QuerySession session = QuerySession.create(ExecutionOptions.build(options));
        session.register("runs", ParquetSource.of(file));
        return session;
    }

    private PhysicalPlan physical(QuerySession session, String sql) {
        return compiler.physicalize(session, compiler.optimize(session, compiler.compile(session, sql)));
    }

    @Test
    @DisplayName("Lookup by id returns exactly the matching row")
    void lookupReturnsOneRow() throws SQLException {
        try (QuerySession session = openSession(Map.of());
             QueryResult result = runner.execute(session, physical(session, RunsDataset.LOOKUP_SQL))) {

            logData("Timing", result.timing());
            assertThat(result.totalRows()).isEqualTo(1);
            assertThat(result.schema().getFields()).extracting("name").containsExactly("json_payload");
            assertThat(result.timing().toMillis()).isGreaterThanOrEqualTo(0.0);
            assertThat(result.timing().format()).matches("\\d+\\.\\d{3} ms");
        }
    }

    @Test
    @DisplayName("Total rows equals the sum of batch row counts")
    void totalRowsSumsBatches() throws SQLException {
        try (QuerySession session = openSession(Map.of("batch_size", 1024));
             QueryResult result = runner.execute(session, physical(session, "SELECT * FROM runs"))) {

            long sum = result.batches().stream().mapToLong(RowBatch::rowCount).sum();
            assertThat(result.totalRows()).isEqualTo(RunsDataset.ROW_COUNT).isEqualTo(sum);
            assertThat(result.batches()).allSatisfy(batch ->
                assertThat(batch.schema()).isEqualTo(result.schema()));
        }
    }

    @Test
    @DisplayName("Optimized logical plans execute too")
    void executesOptimizedPlan() throws SQLException {
        try (QuerySession session = openSession(Map.of())) {
            OptimizedLogicalPlan optimized = compiler.optimize(session,
                compiler.compile(session, "SELECT id FROM runs WHERE attempt > 5"));

            try (QueryResult result = runner.execute(session, optimized)) {
                assertThat(result.totalRows()).isEqualTo(2);
            }
        }
    }

    @Test
    @DisplayName("Pushdown settings do not change the result")
    void pushdownDoesNotChangeResult() throws SQLException {
        try (QuerySession pushed = openSession(Map.of("pushdown_filters", true));
             QuerySession unpushed = QuerySession.create(ExecutionOptions.build(Map.of("pushdown_filters", false)))) {
            unpushed.register("runs", ParquetSource.of(tempDir.resolve("runs.parquet")));

            try (QueryResult a = runner.execute(pushed, physical(pushed, RunsDataset.LOOKUP_SQL));
                 QueryResult b = runner.execute(unpushed, physical(unpushed, RunsDataset.LOOKUP_SQL))) {
                assertThat(a.totalRows()).isEqualTo(b.totalRows()).isEqualTo(1);
            }
        }
    }

    @Test
    @DisplayName("Runtime conversion failure is reported as an EXECUTION failure")
    void runtimeFailure() throws SQLException {
        try (QuerySession session = openSession(Map.of())) {
            PhysicalPlan plan = physical(session, "SELECT CAST(id AS INTEGER) AS n FROM runs");

            assertThatThrownBy(() -> runner.execute(session, plan))
                .isInstanceOf(QueryExecutionException.class)
                .satisfies(e -> {
                    QueryExecutionException qe = (QueryExecutionException) e;
                    assertThat(qe.getKind()).isEqualTo(QueryExecutionException.Kind.FAILURE);
                    assertThat(qe.getStage()).isEqualTo(PlanProbeException.Stage.EXECUTION);
                    assertThat(qe.getFailedSQL()).isEqualTo(plan.sql());
                });
        }
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    @DisplayName("Deadline expiry cancels the query and reports TIMEOUT")
    void deadlineExpiry() throws SQLException {
        try (QuerySession session = openSession(Map.of("timeout_ms", 200))) {
            PhysicalPlan plan = physical(session,
                "SELECT SUM(a.range * b.range) FROM range(200000) a, range(200000) b");

            assertThatThrownBy(() -> runner.execute(session, plan))
                .isInstanceOf(QueryExecutionException.class)
                .satisfies(e -> assertThat(((QueryExecutionException) e).getKind())
                    .isEqualTo(QueryExecutionException.Kind.TIMEOUT));
        }
    }
}
