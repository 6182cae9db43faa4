package org.finos.legend.sqlexpr.typecheck;

/**
 * Controls whether comparison and logical nodes report the aggregates and
 * attribute references found beneath them.
 */
public enum PropagationMode {
    /**
     * Arithmetic and aggregate nodes propagate; comparisons, OR and NOT report
     * no aggregate and contribute no attribute references. This is what
     * {@link org.finos.legend.sqlexpr.plan.Expression#isAggregate()} and
     * {@link org.finos.legend.sqlexpr.plan.Expression#collectAttributeReferences} do.
     */
    LEGACY,

    /**
     * Every node propagates from all of its children.
     */
    FULL
}
