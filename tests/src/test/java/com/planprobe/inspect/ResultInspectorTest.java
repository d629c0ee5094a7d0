package com.planprobe.inspect;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.ColumnException;
import com.planprobe.exception.PlanProbeException;
import com.planprobe.execution.ExecutionRunner;
import com.planprobe.execution.QueryResult;
import com.planprobe.plan.PlanCompiler;
import com.planprobe.session.QuerySession;
import com.planprobe.source.ParquetSource;
import com.planprobe.test.RunsDataset;
import com.planprobe.test.TestBase;
import com.planprobe.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultInspector Tests")
public class ResultInspectorTest extends TestBase {

    private final ResultInspector inspector = new ResultInspector();

    @Nested
    @TestCategories.Tier2
    @TestCategories.Integration
    @DisplayName("Previewing query results")
    class Previewing {

        @TempDir
        Path tempDir;

        private QuerySession session;

        @BeforeEach
        void setUp() throws SQLException {
            session = QuerySession.create(ExecutionOptions.defaults());
            session.register("runs", ParquetSource.of(RunsDataset.write(tempDir)));
        }

        @AfterEach
        void tearDown() {
            session.close();
        }

        private QueryResult run(String sql) {
            PlanCompiler compiler = new PlanCompiler();
            return new ExecutionRunner().execute(session,
                compiler.physicalize(session, compiler.optimize(session, compiler.compile(session, sql))));
        }

        @Test
        @DisplayName("Seven rows previewed five at a time yield the first five in order")
        void boundedByMaxRows() {
            try (QueryResult result = run("SELECT id, json_payload FROM runs ORDER BY attempt")) {
                List<PreviewRow> rows = inspector.preview(result, "json_payload", 5, 100);

                rows.forEach(row -> logData("Row " + row.rowIndex(), row.text()));
                assertThat(rows).hasSize(5);
                assertThat(rows).extracting(PreviewRow::rowIndex).containsExactly(0L, 1L, 2L, 3L, 4L);
                assertThat(rows.get(1).text()).isEqualTo(RunsDataset.TARGET_PAYLOAD);
                assertThat(rows).allSatisfy(row ->
                    assertThat(row.text().codePointCount(0, row.text().length())).isLessThanOrEqualTo(103));
            }
        }

        @Test
        @DisplayName("Long values are cut to the limit plus an ellipsis")
        void longValuesTruncated() {
            try (QueryResult result = run("SELECT json_payload FROM runs ORDER BY attempt")) {
                List<PreviewRow> rows = inspector.preview(result, "json_payload", 5, 100);

                assertThat(rows.get(2).text()).hasSize(103).startsWith("{\"log\":\"xxx").endsWith("x...");
                assertThat(rows.get(3).text()).isEqualTo("é".repeat(100) + "...");
                String emoji = rows.get(4).text();
                assertThat(emoji.codePointCount(0, emoji.length())).isEqualTo(103);
                assertThat(emoji).isEqualTo("😀".repeat(100) + "...");
            }
        }

        @Test
        @DisplayName("Null values are shown as NULL")
        void nullValues() {
            try (QueryResult result = run("SELECT json_payload FROM runs WHERE attempt = 6")) {
                assertThat(inspector.preview(result, "json_payload", 5, 100))
                    .extracting(PreviewRow::text)
                    .containsExactly(ResultInspector.NULL_TEXT);
            }
        }

        @Test
        @DisplayName("String columns are displayable")
        void stringColumn() {
            try (QueryResult result = run(RunsDataset.LOOKUP_SQL.replace("SELECT json_payload", "SELECT id"))) {
                assertThat(inspector.preview(result, "id", 5, 100))
                    .extracting(PreviewRow::text)
                    .containsExactly(RunsDataset.TARGET_ID);
            }
        }

        @Test
        @DisplayName("Unknown column fails with NOT_FOUND even on an empty result")
        void unknownColumn() {
            try (QueryResult result = run("SELECT json_payload FROM runs WHERE attempt > 100")) {
                assertThat(result.totalRows()).isZero();

                assertThatThrownBy(() -> inspector.preview(result, "payload", 5, 100))
                    .isInstanceOf(ColumnException.class)
                    .satisfies(e -> {
                        ColumnException ce = (ColumnException) e;
                        assertThat(ce.getKind()).isEqualTo(ColumnException.Kind.NOT_FOUND);
                        assertThat(ce.getIdentifier()).isEqualTo("payload");
                        assertThat(ce.getStage()).isEqualTo(PlanProbeException.Stage.DISPLAY);
                    });
            }
        }

        @Test
        @DisplayName("Integer column is not displayable")
        void integerColumnRejected() {
            try (QueryResult result = run("SELECT attempt FROM runs")) {
                assertThatThrownBy(() -> inspector.preview(result, "attempt", 5, 100))
                    .isInstanceOf(ColumnException.class)
                    .hasMessageContaining("not a string or binary column");
            }
        }

        @Test
        @DisplayName("First displayable column skips numeric columns")
        void firstDisplayableColumn() {
            try (QueryResult result = run("SELECT attempt, json_payload, id FROM runs")) {
                assertThat(inspector.firstDisplayableColumn(result.schema())).contains("json_payload");
            }
            try (QueryResult result = run("SELECT count(*) AS n, max(attempt) AS top FROM runs")) {
                assertThat(inspector.firstDisplayableColumn(result.schema())).isEmpty();
            }
        }

        @Test
        @DisplayName("Batch list without batches has no columns")
        void emptyBatchList() {
            assertThatThrownBy(() -> inspector.preview(List.of(), "json_payload", 5, 100))
                .isInstanceOf(ColumnException.class);
        }
    }

    @Nested
    @TestCategories.Tier1
    @TestCategories.Unit
    @DisplayName("Truncation")
    class Truncation {

        @Test
        @DisplayName("Short text is returned unchanged")
        void shortText() {
            assertThat(ResultInspector.truncate("abc", 3)).isEqualTo("abc");
        }

        @Test
        @DisplayName("Long text keeps the prefix and appends the marker")
        void longText() {
            assertThat(ResultInspector.truncate("abcdef", 3)).isEqualTo("abc...");
        }

        @Test
        @DisplayName("Surrogate pairs are never split")
        void surrogatePairs() {
            String text = "😀😀😀";

            assertThat(ResultInspector.truncate(text, 1)).isEqualTo("😀...");
        }

        @Test
        @DisplayName("Zero length keeps only the marker")
        void zeroLength() {
            assertThat(ResultInspector.truncate("abc", 0)).isEqualTo("...");
        }
    }
}
