package com.planprobe.exception;

import com.planprobe.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests that failures carry their stage, kind and the offending identifier.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Reporting Tests")
public class ErrorReportingTest {

    @Nested
    @DisplayName("Engine message parsing")
    class EngineMessageParsing {

        @Test
        @DisplayName("Missing column is extracted from binder errors")
        void missingColumn() {
            String message = "Binder Error: Referenced column \"no_such_column\" not found in FROM clause!\n" +
                "Candidate bindings: \"runs.id\"";

            assertThat(EngineMessages.offendingIdentifier(message)).isEqualTo("no_such_column");
            assertThat(EngineMessages.isCompileTimeError(message)).isTrue();
        }

        @Test
        @DisplayName("Missing table is extracted from catalog errors")
        void missingTable() {
            String message = "Catalog Error: Table with name missing_table does not exist!\n" +
                "Did you mean \"runs\"?";

            assertThat(EngineMessages.offendingIdentifier(message)).isEqualTo("missing_table");
        }

        @Test
        @DisplayName("Offending token is extracted from parser errors")
        void syntaxError() {
            String message = "Parser Error: syntax error at or near \"FORM\"";

            assertThat(EngineMessages.offendingIdentifier(message)).isEqualTo("FORM");
        }

        @Test
        @DisplayName("Unconvertible value is extracted from conversion errors")
        void conversionError() {
            String message = "Conversion Error: Could not convert string 'run-0001' to INT32";

            assertThat(EngineMessages.offendingIdentifier(message)).isEqualTo("run-0001");
            assertThat(EngineMessages.isCompileTimeError(message)).isFalse();
        }

        @Test
        @DisplayName("Unrecognized or null messages yield no identifier")
        void unrecognized() {
            assertThat(EngineMessages.offendingIdentifier("Something else went wrong")).isNull();
            assertThat(EngineMessages.offendingIdentifier(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Stage taxonomy")
    class StageTaxonomy {

        @Test
        @DisplayName("Compilation phases map to their stages")
        void compilationPhases() {
            assertThat(new PlanCompilationException(PlanCompilationException.Phase.PARSE, "m", null, "sql").getStage())
                .isEqualTo(PlanProbeException.Stage.PARSE);
            assertThat(new PlanCompilationException(PlanCompilationException.Phase.OPTIMIZE, "m", null, "sql").getStage())
                .isEqualTo(PlanProbeException.Stage.OPTIMIZE);
            assertThat(new PlanCompilationException(PlanCompilationException.Phase.PLANNING, "m", null, "sql")
                .getKindName()).isEqualTo("PLANNING_ERROR");
        }

        @Test
        @DisplayName("Registration failure keeps its cause")
        void registrationCause() {
            SQLException cause = new SQLException("IO Error: No such file");
            RegistrationException e = new RegistrationException(
                RegistrationException.Kind.SOURCE_UNAVAILABLE, "runs", "Cannot open", cause);

            assertThat(e.getCause()).isSameAs(cause);
            assertThat(e.getStage()).isEqualTo(PlanProbeException.Stage.REGISTRATION);
            assertThat(e.toReportLine()).isEqualTo("Stage REGISTRATION failed: SOURCE_UNAVAILABLE 'runs': Cannot open");
        }

        @Test
        @DisplayName("Report line omits a missing identifier")
        void reportLineWithoutIdentifier() {
            QueryExecutionException e = new QueryExecutionException(
                QueryExecutionException.Kind.FAILURE, "boom", "SELECT 1");

            assertThat(e.toReportLine()).isEqualTo("Stage EXECUTION failed: FAILURE: boom");
        }
    }

    @Nested
    @DisplayName("Execution failure messages")
    class ExecutionMessages {

        @Test
        @DisplayName("Conversion errors name the value in the user message")
        void conversionUserMessage() {
            QueryExecutionException e = new QueryExecutionException(QueryExecutionException.Kind.FAILURE,
                "Conversion Error: Could not convert string 'abc' to INT32", "SELECT CAST(id AS INT) FROM runs");

            assertThat(e.getIdentifier()).isEqualTo("abc");
            assertThat(e.getUserMessage()).contains("'abc'");
            assertThat(e.getFailedSQL()).isEqualTo("SELECT CAST(id AS INT) FROM runs");
        }

        @Test
        @DisplayName("Timeouts suggest raising timeout_ms")
        void timeoutUserMessage() {
            QueryExecutionException e = new QueryExecutionException(
                QueryExecutionException.Kind.TIMEOUT, "cancelled", "SELECT 1");

            assertThat(e.getUserMessage()).contains("timeout_ms");
            assertThat(e.getKindName()).isEqualTo("TIMEOUT");
        }

        @Test
        @DisplayName("Technical message includes SQL and cause")
        void technicalMessage() {
            QueryExecutionException e = new QueryExecutionException(QueryExecutionException.Kind.FAILURE,
                "IO Error: No files found", new SQLException("io"), "SELECT * FROM runs");

            assertThat(e.getTechnicalMessage())
                .contains("FAILURE")
                .contains("SELECT * FROM runs")
                .contains("java.sql.SQLException");
            assertThat(e.getUserMessage()).startsWith("File not found");
        }
    }
}
