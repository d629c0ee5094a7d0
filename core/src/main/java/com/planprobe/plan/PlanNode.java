package com.planprobe.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable node of an engine plan tree.
 *
 * <p>A node carries the engine's operator name (e.g. {@code TABLE_SCAN},
 * {@code FILTER}, {@code PROJECTION}), the operator details the engine
 * reports, in the engine's order, and its children.
 *
 * <p>The textual rendering is indented by two spaces per level:
 * <pre>
 * PROJECTION: Projections=json_payload
 *   TABLE_SCAN: Function=READ_PARQUET, Filters=id='2ef7...'
 * </pre>
 * Equal trees always render to the same text.
 */
public final class PlanNode {

    private final String name;
    private final Map<String, String> details;
    private final List<PlanNode> children;

    public PlanNode(String name, Map<String, String> details, List<PlanNode> children) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.children = List.copyOf(children);
    }

    public static PlanNode leaf(String name, Map<String, String> details) {
        return new PlanNode(name, details, List.of());
    }

    public String name() {
        return name;
    }

    public Map<String, String> details() {
        return details;
    }

    public List<PlanNode> children() {
        return children;
    }

    /**
     * True for operators that read a relation.
     *
     * @return true for table, sequential and Parquet scans
     */
    public boolean isScan() {
        String upper = name.toUpperCase(Locale.ROOT);
        return upper.contains("SCAN")
            || upper.equals("GET")
            || upper.contains("READ_PARQUET")
            || details.containsKey("Function");
    }

    /**
     * True for standalone filter operators.
     *
     * @return true if this is a FILTER operator
     */
    public boolean isFilter() {
        return name.equalsIgnoreCase("FILTER");
    }

    /**
     * Details whose key names a filter, e.g. {@code Filters} on a scan.
     *
     * @return filter predicates reported on this node, in engine order
     */
    public List<String> filterDetails() {
        List<String> filters = new ArrayList<>();
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).contains("filter")) {
                filters.add(entry.getValue());
            }
        }
        return filters;
    }

    /**
     * Collects matching nodes in pre-order.
     *
     * @param predicate node filter
     * @return matching nodes, this node first when it matches
     */
    public List<PlanNode> find(Predicate<PlanNode> predicate) {
        List<PlanNode> matches = new ArrayList<>();
        collect(this, predicate, matches);
        return matches;
    }

    private static void collect(PlanNode node, Predicate<PlanNode> predicate, List<PlanNode> out) {
        if (predicate.test(node)) {
            out.add(node);
        }
        for (PlanNode child : node.children) {
            collect(child, predicate, out);
        }
    }

    /**
     * Operator names in pre-order.
     *
     * @return operator names
     */
    public List<String> operatorNames() {
        return find(node -> true).stream().map(PlanNode::name).toList();
    }

    /**
     * True if any descendant (not this node) matches.
     *
     * @param predicate node filter
     * @return true if a strict descendant matches
     */
    public boolean hasDescendant(Predicate<PlanNode> predicate) {
        return children.stream().anyMatch(child -> !child.find(predicate).isEmpty());
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        render(this, 0, sb);
        return sb.toString();
    }

    private static void render(PlanNode node, int depth, StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append("  ".repeat(depth)).append(node.name);
        if (!node.details.isEmpty()) {
            sb.append(": ");
            boolean first = true;
            for (Map.Entry<String, String> entry : node.details.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
        }
        for (PlanNode child : node.children) {
            render(child, depth + 1, sb);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanNode)) return false;
        PlanNode other = (PlanNode) o;
        return name.equals(other.name)
            && details.equals(other.details)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, details, children);
    }

    @Override
    public String toString() {
        return render();
    }
}
