package org.finos.legend.sqlexpr.plan;

import org.finos.legend.sqlexpr.store.AliasBindings;
import org.finos.legend.sqlexpr.store.Catalog;
import org.finos.legend.sqlexpr.typecheck.AggregateClassifier;
import org.finos.legend.sqlexpr.typecheck.AttributeReferenceCollector;
import org.finos.legend.sqlexpr.typecheck.ExpressionTypeChecker;
import org.finos.legend.sqlexpr.typecheck.ReturnType;
import org.finos.legend.sqlexpr.typecheck.TypeCheckOptions;

import java.util.List;
import java.util.Set;

/**
 * Sealed interface representing scalar and boolean SQL expressions.
 * Trees are built bottom-up by the planner and never mutated afterwards.
 *
 * Includes:
 * - Literal: constant bool, int, double or string value
 * - AttributeReference: alias.attribute reference into a FROM-clause table
 * - ArithmeticExpression: +, -, *, /
 * - ComparisonExpression: &gt;, &lt;, ==, !=
 * - LogicalExpression: OR, NOT
 * - AggregateExpression: SUM, AVG
 */
public sealed interface Expression
        permits Literal, AttributeReference, ArithmeticExpression, ComparisonExpression,
        LogicalExpression, AggregateExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return The direct sub-expressions of this node, left to right
     */
    List<Expression> children();

    /**
     * Recursive; a tree nested deeper than the thread's stack allows throws
     * {@link StackOverflowError}. Check {@link ExpressionDepth} first for
     * untrusted trees.
     *
     * @return The canonical string form of this expression
     */
    default String render() {
        return accept(ExpressionRenderer.INSTANCE);
    }

    /**
     * Infers the type of this expression. Failures are reported as
     * {@link ReturnType#ERROR}, never thrown. A tree nested deeper than
     * {@link TypeCheckOptions#DEFAULT_MAX_DEPTH} is also {@code ERROR}; use
     * {@link ExpressionTypeChecker} directly to see the diagnostics or raise the limit.
     */
    default ReturnType typeCheck(Catalog catalog, AliasBindings aliasBindings) {
        return new ExpressionTypeChecker(catalog, aliasBindings, TypeCheckOptions.defaults())
                .check(this)
                .type();
    }

    /**
     * Recursive, like {@link #render()}.
     *
     * @return true if evaluating this expression requires group-level aggregation
     */
    default boolean isAggregate() {
        return AggregateClassifier.LEGACY.isAggregate(this);
    }

    /**
     * Adds every attribute reference reachable from this expression to the given set.
     * Recursive, like {@link #render()}.
     */
    default void collectAttributeReferences(Set<AttributeReference> references) {
        AttributeReferenceCollector.LEGACY.collect(this, references);
    }
}
