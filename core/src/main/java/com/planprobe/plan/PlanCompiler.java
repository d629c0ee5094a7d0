package com.planprobe.plan;

import com.planprobe.exception.EngineMessages;
import com.planprobe.exception.PlanCompilationException;
import com.planprobe.exception.PlanCompilationException.Phase;
import com.planprobe.session.QuerySession;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Produces the logical, optimized logical and physical plans of one SQL
 * statement.
 *
 * <p>DuckDB does not accept a plan tree as input, so every stage asks the
 * engine to explain the statement the previous stage's plan carries, with
 * {@code explain_output='all'}, and keeps the tree for its own stage. Before
 * returning, a stage checks that the engine still derives the same input tree
 * it was handed; if the session changed in between, the stage fails rather
 * than pair plans of two different queries. Nothing is executed and no plan
 * is cached: each call recomputes its result, and equal inputs give equal
 * outputs.
 *
 * <p>Example usage:
 * <pre>
 *   PlanCompiler compiler = new PlanCompiler();
 *   LogicalPlan logical = compiler.compile(session, sql);
 *   OptimizedLogicalPlan optimized = compiler.optimize(session, logical);
 *   PhysicalPlan physical = compiler.physicalize(session, optimized);
 * </pre>
 */
public class PlanCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PlanCompiler.class);

    private static final String EXPLAIN_PREFIX = "EXPLAIN (FORMAT JSON) ";

    /**
     * Parse and bind a statement.
     *
     * @param session the session holding the referenced relations
     * @param sql one SQL statement
     * @return the unoptimized logical plan
     * @throws PlanCompilationException ({@link Phase#PARSE}) on malformed SQL, several
     *         statements, or unresolvable relation/column references
     */
    public LogicalPlan compile(QuerySession session, String sql) {
        Objects.requireNonNull(session, "session must not be null");
        String statement;
        try {
            statement = SqlStatements.singleStatement(sql);
        } catch (IllegalArgumentException e) {
            throw new PlanCompilationException(Phase.PARSE, e.getMessage(), ";", sql, e);
        }

        Map<PlanStage, PlanNode> stages = explain(session, statement, Phase.PARSE);
        LogicalPlan plan = new LogicalPlan(statement, require(stages, PlanStage.LOGICAL, Phase.PARSE, statement));
        logger.debug("Compiled logical plan with {} operators", plan.root().operatorNames().size());
        return plan;
    }

    /**
     * Derive the optimized logical plan.
     *
     * @param session the session the plan was compiled in
     * @param plan the logical plan
     * @return the optimized logical plan
     * @throws PlanCompilationException ({@link Phase#OPTIMIZE}) if the engine fails or the
     *         session no longer yields the given logical plan
     */
    public OptimizedLogicalPlan optimize(QuerySession session, LogicalPlan plan) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(plan, "plan must not be null");

        Map<PlanStage, PlanNode> stages = explain(session, plan.sql(), Phase.OPTIMIZE);
        verifyUnchanged(stages, PlanStage.LOGICAL, plan, Phase.OPTIMIZE);
        return new OptimizedLogicalPlan(plan.sql(),
            require(stages, PlanStage.OPTIMIZED_LOGICAL, Phase.OPTIMIZE, plan.sql()));
    }

    /**
     * Derive the physical plan.
     *
     * <p>The result reflects the session's pushdown options: with
     * {@code pushdown_filters} enabled the scan reports the predicate, with it
     * disabled a FILTER operator sits above the scan.
     *
     * @param session the session the plan was compiled in
     * @param plan the optimized logical plan
     * @return the physical plan
     * @throws PlanCompilationException ({@link Phase#PLANNING}) if the engine fails or the
     *         session no longer yields the given optimized plan
     */
    public PhysicalPlan physicalize(QuerySession session, OptimizedLogicalPlan plan) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(plan, "plan must not be null");

        Map<PlanStage, PlanNode> stages = explain(session, plan.sql(), Phase.PLANNING);
        verifyUnchanged(stages, PlanStage.OPTIMIZED_LOGICAL, plan, Phase.PLANNING);
        PhysicalPlan physical = new PhysicalPlan(plan.sql(),
            require(stages, PlanStage.PHYSICAL, Phase.PLANNING, plan.sql()));
        logger.debug("Physical plan: {} scans, pushed filters {}, filter above scan: {}",
            physical.scanNodes().size(), physical.pushedFilters(), physical.hasFilterAboveScan());
        return physical;
    }

    private Map<PlanStage, PlanNode> explain(QuerySession session, String sql, Phase phase) {
        Map<PlanStage, PlanNode> stages = new EnumMap<>(PlanStage.class);
        try (DuckDBConnection conn = session.openConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(EXPLAIN_PREFIX + sql)) {
            while (rs.next()) {
                String key = rs.getString(1);
                String value = rs.getString(2);
                PlanStage stage = PlanStage.fromEngineKey(key).orElse(null);
                if (stage == null) {
                    logger.debug("Ignoring explain output '{}'", key);
                    continue;
                }
                stages.put(stage, parse(value, stage, phase, sql));
            }
        } catch (SQLException e) {
            String message = e.getMessage();
            throw new PlanCompilationException(phase, message,
                EngineMessages.offendingIdentifier(message), sql, e);
        }
        return stages;
    }

    private PlanNode parse(String rendering, PlanStage stage, Phase phase, String sql) {
        try {
            return ExplainTreeParser.parse(rendering);
        } catch (IllegalArgumentException e) {
            throw new PlanCompilationException(phase,
                "Unreadable " + stage.engineKey() + " rendering: " + e.getMessage(), stage.engineKey(), sql, e);
        }
    }

    private PlanNode require(Map<PlanStage, PlanNode> stages, PlanStage stage, Phase phase, String sql) {
        PlanNode node = stages.get(stage);
        if (node == null) {
            throw new PlanCompilationException(phase,
                "Engine did not report " + stage.engineKey() + " (is explain_output set to 'all'?)",
                stage.engineKey(), sql);
        }
        return node;
    }

    private void verifyUnchanged(Map<PlanStage, PlanNode> stages, PlanStage stage, CompiledPlan input, Phase phase) {
        PlanNode current = require(stages, stage, phase, input.sql());
        if (!current.equals(input.root())) {
            throw new PlanCompilationException(phase,
                "Session state changed since the " + stage.engineKey() + " was produced; recompile the query",
                stage.engineKey(), input.sql());
        }
    }
}
