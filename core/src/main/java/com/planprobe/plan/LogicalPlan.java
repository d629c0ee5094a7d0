package com.planprobe.plan;

/**
 * Unoptimized logical plan, as bound by the engine.
 */
public final class LogicalPlan extends CompiledPlan {

    public LogicalPlan(String sql, PlanNode root) {
        super(sql, root);
    }

    @Override
    public PlanStage stage() {
        return PlanStage.LOGICAL;
    }
}
