package com.planprobe.explain;

import com.planprobe.plan.ExplainTreeParser;
import com.planprobe.plan.PhysicalPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares the operator shape of an independently compiled physical plan
 * with the plan reported by EXPLAIN ANALYZE.
 *
 * <p>The analyzed plan is rendered text, so the check counts whole-word
 * occurrences of each operator name: every operator of the physical plan must
 * appear in the analyzed plan at least as often as it does in the physical
 * plan. Row counts and timings are not compared; two executions of the same
 * query may legitimately differ there.
 *
 * <p>Scans are compared as one operator kind. The JSON physical plan names a
 * Parquet scan after its table function ({@code READ_PARQUET}) while the
 * rendered analyzed plan heads the same box {@code TABLE_SCAN} and lists the
 * function only as a detail. Details are never counted as operators.
 */
public final class PlanShapeCheck {

    static final String SCAN = "TABLE_SCAN";

    // Operator headers the engine renders for scans
    private static final List<String> SCAN_HEADERS = List.of("TABLE_SCAN", "SEQ_SCAN", "PARQUET_SCAN");

    private PlanShapeCheck() {}

    /**
     * Lists the physical operators missing from the analyzed plan.
     *
     * @param physical the compiled physical plan
     * @param records the explain analyze output
     * @return operator names (one entry per missing occurrence); empty when the shapes match
     */
    public static List<String> missingOperators(PhysicalPlan physical, List<ExplainRecord> records) {
        StringBuilder analyzed = new StringBuilder();
        for (ExplainRecord record : records) {
            analyzed.append(record.stageText()).append('\n');
        }

        Map<String, Integer> expected = new LinkedHashMap<>();
        for (String name : physical.root().operatorNames()) {
            if (!name.equals(ExplainTreeParser.SYNTHETIC_ROOT)) {
                expected.merge(operatorKind(name), 1, Integer::sum);
            }
        }

        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : expected.entrySet()) {
            int found = countOperator(analyzed, entry.getKey());
            for (int i = found; i < entry.getValue(); i++) {
                missing.add(entry.getKey());
            }
        }
        return missing;
    }

    /**
     * True if every physical operator appears in the analyzed plan.
     *
     * @param physical the compiled physical plan
     * @param records the explain analyze output
     * @return true if the shapes match
     */
    public static boolean matches(PhysicalPlan physical, List<ExplainRecord> records) {
        return missingOperators(physical, records).isEmpty();
    }

    /**
     * Maps a physical operator name to the kind the analyzed plan renders.
     *
     * @param name operator name from the physical plan
     * @return {@value #SCAN} for any scan or table-function read, else the name itself
     */
    static String operatorKind(String name) {
        if (name.endsWith("_SCAN") || name.startsWith("READ_")) {
            return SCAN;
        }
        return name;
    }

    private static int countOperator(CharSequence analyzed, String kind) {
        if (!kind.equals(SCAN)) {
            return countWord(analyzed, kind);
        }
        int count = 0;
        for (String header : SCAN_HEADERS) {
            count += countWord(analyzed, header);
        }
        return count;
    }

    private static int countWord(CharSequence text, String word) {
        Matcher matcher = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(word) + "(?![A-Za-z0-9_])")
            .matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
