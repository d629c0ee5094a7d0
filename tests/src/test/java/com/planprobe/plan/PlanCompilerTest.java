package com.planprobe.plan;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.PlanCompilationException;
import com.planprobe.exception.PlanProbeException;
import com.planprobe.session.QuerySession;
import com.planprobe.source.ParquetSource;
import com.planprobe.test.RunsDataset;
import com.planprobe.test.TestBase;
import com.planprobe.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("PlanCompiler Tests")
public class PlanCompilerTest extends TestBase {

    @TempDir
    Path tempDir;

    private final PlanCompiler compiler = new PlanCompiler();

    private QuerySession openSession(Map<String, ?> options) throws SQLException {
        Path file = RunsDataset.write(tempDir);
        QuerySession session = QuerySession.create(ExecutionOptions.build(options));
        session.register("runs", ParquetSource.of(file));
        return session;
    }

    @Nested
    @DisplayName("Plan derivation")
    class Derivation {

        @Test
        @DisplayName("Each stage yields a plan for the same statement")
        void stagesShareStatement() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                LogicalPlan logical = compiler.compile(session, RunsDataset.LOOKUP_SQL + ";");
                OptimizedLogicalPlan optimized = compiler.optimize(session, logical);
                PhysicalPlan physical = compiler.physicalize(session, optimized);

                logData("Physical plan", "\n" + physical.render());
                assertThat(logical.sql()).isEqualTo(RunsDataset.LOOKUP_SQL);
                assertThat(optimized.sql()).isEqualTo(logical.sql());
                assertThat(physical.sql()).isEqualTo(logical.sql());
                assertThat(logical.stage()).isEqualTo(PlanStage.LOGICAL);
                assertThat(physical.scanNodes()).isNotEmpty();
            }
        }

        @Test
        @DisplayName("Compiling twice yields equal plans and renderings")
        void deterministic() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                PhysicalPlan first = compiler.physicalize(session,
                    compiler.optimize(session, compiler.compile(session, RunsDataset.LOOKUP_SQL)));
                PhysicalPlan second = compiler.physicalize(session,
                    compiler.optimize(session, compiler.compile(session, RunsDataset.LOOKUP_SQL)));

                assertThat(second).isEqualTo(first);
                assertThat(second.render()).isEqualTo(first.render());
            }
        }

        @Test
        @DisplayName("A plan the session no longer produces is rejected")
        void staleInputRejected() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                LogicalPlan stale = new LogicalPlan(RunsDataset.LOOKUP_SQL, PlanNode.leaf("STALE", Map.of()));

                assertThatThrownBy(() -> compiler.optimize(session, stale))
                    .isInstanceOf(PlanCompilationException.class)
                    .hasMessageContaining("Session state changed")
                    .satisfies(e -> assertThat(((PlanCompilationException) e).getStage())
                        .isEqualTo(PlanProbeException.Stage.OPTIMIZE));
            }
        }
    }

    @Nested
    @DisplayName("Predicate pushdown")
    class Pushdown {

        @Test
        @DisplayName("With pushdown enabled the scan carries the id predicate")
        void pushdownEnabled() throws SQLException {
            try (QuerySession session = openSession(Map.of("pushdown_filters", true))) {
                PhysicalPlan physical = compiler.physicalize(session,
                    compiler.optimize(session, compiler.compile(session, RunsDataset.LOOKUP_SQL)));

                logData("Pushed filters", physical.pushedFilters());
                assertThat(physical.pushedFilters())
                    .anySatisfy(filter -> assertThat(filter).contains(RunsDataset.TARGET_ID));
                assertThat(physical.hasFilterAboveScan()).isFalse();
            }
        }

        @Test
        @DisplayName("With pushdown disabled a FILTER operator sits above the scan")
        void pushdownDisabled() throws SQLException {
            try (QuerySession session = openSession(Map.of("pushdown_filters", false))) {
                PhysicalPlan physical = compiler.physicalize(session,
                    compiler.optimize(session, compiler.compile(session, RunsDataset.LOOKUP_SQL)));

                logData("Physical plan", "\n" + physical.render());
                assertThat(physical.hasFilterAboveScan()).isTrue();
                assertThat(physical.pushedFilters()).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Parse failures")
    class ParseFailures {

        @Test
        @DisplayName("Unknown column fails at PARSE naming the column")
        void unknownColumn() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                assertThatThrownBy(() -> compiler.compile(session, "SELECT no_such_column FROM runs"))
                    .isInstanceOf(PlanCompilationException.class)
                    .satisfies(e -> {
                        PlanCompilationException pce = (PlanCompilationException) e;
                        assertThat(pce.getPhase()).isEqualTo(PlanCompilationException.Phase.PARSE);
                        assertThat(pce.getIdentifier()).isEqualTo("no_such_column");
                    });
            }
        }

        @Test
        @DisplayName("Unknown relation fails at PARSE naming the relation")
        void unknownRelation() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                assertThatThrownBy(() -> compiler.compile(session, "SELECT * FROM missing_table"))
                    .isInstanceOf(PlanCompilationException.class)
                    .satisfies(e -> assertThat(((PlanCompilationException) e).getIdentifier())
                        .isEqualTo("missing_table"));
            }
        }

        @Test
        @DisplayName("Multiple statements fail at PARSE")
        void multipleStatements() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                assertThatThrownBy(() -> compiler.compile(session, "SELECT 1; SELECT 2"))
                    .isInstanceOf(PlanCompilationException.class)
                    .satisfies(e -> assertThat(((PlanCompilationException) e).getStage())
                        .isEqualTo(PlanProbeException.Stage.PARSE));
            }
        }

        @Test
        @DisplayName("Malformed SQL fails at PARSE")
        void malformedSql() throws SQLException {
            try (QuerySession session = openSession(Map.of())) {
                assertThatThrownBy(() -> compiler.compile(session, "SELEC json_payload FROM runs"))
                    .isInstanceOf(PlanCompilationException.class)
                    .satisfies(e -> assertThat(((PlanCompilationException) e).getPhase())
                        .isEqualTo(PlanCompilationException.Phase.PARSE));
            }
        }
    }
}
