package com.planprobe.plan;

/**
 * Logical plan after the engine's optimizer rewrote it.
 */
public final class OptimizedLogicalPlan extends CompiledPlan {

    public OptimizedLogicalPlan(String sql, PlanNode root) {
        super(sql, root);
    }

    @Override
    public PlanStage stage() {
        return PlanStage.OPTIMIZED_LOGICAL;
    }
}
