package com.planprobe.plan;

import java.util.Objects;

/**
 * Base class of the three plan artifacts.
 *
 * <p>A compiled plan is an immutable value: the SQL it was compiled from and
 * the engine's plan tree for one {@link PlanStage}. Later stages are derived
 * from earlier ones by the {@link PlanCompiler}, never by mutation.
 */
public abstract class CompiledPlan {

    private final String sql;
    private final PlanNode root;

    protected CompiledPlan(String sql, PlanNode root) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public abstract PlanStage stage();

    /**
     * The single, normalized SQL statement this plan describes.
     *
     * @return the SQL text
     */
    public String sql() {
        return sql;
    }

    public PlanNode root() {
        return root;
    }

    /**
     * Stable indented rendering of the plan tree.
     *
     * @return the rendering
     */
    public String render() {
        return root.render();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompiledPlan other = (CompiledPlan) o;
        return sql.equals(other.sql) && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), sql, root);
    }

    @Override
    public String toString() {
        return stage().title() + ":\n" + render();
    }
}
