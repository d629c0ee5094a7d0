package com.planprobe.plan;

import com.planprobe.test.TestBase;
import com.planprobe.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExplainTreeParser Tests")
public class ExplainTreeParserTest extends TestBase {

    private static final String PUSHED_SCAN_PLAN =
        "[{\"name\": \"PROJECTION\", \"children\": [" +
        "  {\"name\": \"TABLE_SCAN\", \"children\": [], \"extra_info\": {" +
        "     \"Function\": \"READ_PARQUET\"," +
        "     \"Projections\": \"json_payload\"," +
        "     \"Filters\": \"id='2ef7079b-541a-4229-bd00-e6c00402e8f1'\"," +
        "     \"Estimated Cardinality\": \"1\"}}]," +
        " \"extra_info\": {\"Projections\": \"#0\"}}]";

    @Nested
    @DisplayName("Well-formed documents")
    class WellFormed {

        @Test
        @DisplayName("Nested operators become a tree with details in engine order")
        void parsesTree() {
            PlanNode root = ExplainTreeParser.parse(PUSHED_SCAN_PLAN);

            assertThat(root.name()).isEqualTo("PROJECTION");
            assertThat(root.children()).hasSize(1);
            PlanNode scan = root.children().get(0);
            assertThat(scan.name()).isEqualTo("TABLE_SCAN");
            assertThat(scan.details().keySet())
                .containsExactly("Function", "Projections", "Filters", "Estimated Cardinality");
            assertThat(scan.isScan()).isTrue();
        }

        @Test
        @DisplayName("Array and multi-line values are joined with commas")
        void joinsListValues() {
            String json = "{\"name\": \"TABLE_SCAN\", \"children\": [], \"extra_info\": {" +
                "\"Projections\": [\"id\", \"json_payload\"], \"Filters\": \"a=1\\nb=2\\n\"}}";

            PlanNode node = ExplainTreeParser.parse(json);

            assertThat(node.details())
                .containsEntry("Projections", "id, json_payload")
                .containsEntry("Filters", "a=1, b=2");
        }

        @Test
        @DisplayName("Several top-level operators are wrapped in a synthetic root")
        void wrapsSeveralRoots() {
            PlanNode root = ExplainTreeParser.parse("[{\"name\": \"A\"}, {\"name\": \"B\"}]");

            assertThat(root.name()).isEqualTo(ExplainTreeParser.SYNTHETIC_ROOT);
            assertThat(root.operatorNames()).containsExactly("PLAN", "A", "B");
        }

        @Test
        @DisplayName("Same document parses to equal trees")
        void deterministic() {
            PlanNode first = ExplainTreeParser.parse(PUSHED_SCAN_PLAN);
            PlanNode second = ExplainTreeParser.parse(PUSHED_SCAN_PLAN);

            assertThat(first).isEqualTo(second);
            assertThat(first.render()).isEqualTo(second.render());
        }
    }

    @Nested
    @DisplayName("Malformed documents")
    class Malformed {

        @Test
        @DisplayName("Empty text is rejected")
        void emptyRejected() {
            assertThatThrownBy(() -> ExplainTreeParser.parse("  "))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Text rendering is rejected")
        void textRejected() {
            assertThatThrownBy(() -> ExplainTreeParser.parse("┌───────────┐\n│ PROJECTION │"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON");
        }

        @Test
        @DisplayName("Node without a name is rejected")
        void namelessNodeRejected() {
            assertThatThrownBy(() -> ExplainTreeParser.parse("[{\"children\": []}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without a name");
        }
    }
}
