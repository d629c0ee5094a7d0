package com.planprobe.plan;

import java.util.List;

/**
 * Executable plan bound to concrete operators and access paths.
 *
 * <p>The accessors answer the question the probe exists for: did the filter
 * reach the scan? With filter pushdown enabled, {@link #pushedFilters()} lists
 * the predicates the scan applies itself; with pushdown disabled,
 * {@link #hasFilterAboveScan()} is true instead.
 */
public final class PhysicalPlan extends CompiledPlan {

    public PhysicalPlan(String sql, PlanNode root) {
        super(sql, root);
    }

    @Override
    public PlanStage stage() {
        return PlanStage.PHYSICAL;
    }

    public List<PlanNode> scanNodes() {
        return root().find(PlanNode::isScan);
    }

    /**
     * Filter predicates reported by scan operators.
     *
     * @return predicates in plan order; empty if nothing was pushed down
     */
    public List<String> pushedFilters() {
        return scanNodes().stream()
            .flatMap(scan -> scan.filterDetails().stream())
            .toList();
    }

    /**
     * True if a standalone FILTER operator consumes the output of a scan.
     *
     * @return true if filtering happens downstream of a scan
     */
    public boolean hasFilterAboveScan() {
        return root().find(PlanNode::isFilter).stream()
            .anyMatch(filter -> filter.hasDescendant(PlanNode::isScan));
    }
}
