package org.finos.legend.sqlexpr.typecheck;

import org.finos.legend.sqlexpr.plan.AggregateExpression;
import org.finos.legend.sqlexpr.plan.ArithmeticExpression;
import org.finos.legend.sqlexpr.plan.AttributeReference;
import org.finos.legend.sqlexpr.plan.ComparisonExpression;
import org.finos.legend.sqlexpr.plan.Expression;
import org.finos.legend.sqlexpr.plan.ExpressionVisitor;
import org.finos.legend.sqlexpr.plan.Literal;
import org.finos.legend.sqlexpr.plan.LogicalExpression;

import java.util.Objects;

/**
 * Decides whether an expression needs group-level aggregation: SUM and AVG
 * always do, and other nodes do when a propagating child does.
 */
public final class AggregateClassifier implements ExpressionVisitor<Boolean> {

    public static final AggregateClassifier LEGACY = new AggregateClassifier(PropagationMode.LEGACY);
    public static final AggregateClassifier FULL = new AggregateClassifier(PropagationMode.FULL);

    private final PropagationMode mode;

    private AggregateClassifier(PropagationMode mode) {
        this.mode = Objects.requireNonNull(mode);
    }

    public static AggregateClassifier forMode(PropagationMode mode) {
        return mode == PropagationMode.FULL ? FULL : LEGACY;
    }

    public boolean isAggregate(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Boolean visitLiteral(Literal literal) {
        return false;
    }

    @Override
    public Boolean visitAttributeReference(AttributeReference reference) {
        return false;
    }

    @Override
    public Boolean visitArithmetic(ArithmeticExpression arithmetic) {
        return arithmetic.left().accept(this) || arithmetic.right().accept(this);
    }

    @Override
    public Boolean visitComparison(ComparisonExpression comparison) {
        if (mode == PropagationMode.LEGACY) {
            return false;
        }
        return comparison.left().accept(this) || comparison.right().accept(this);
    }

    @Override
    public Boolean visitLogical(LogicalExpression logical) {
        if (mode == PropagationMode.LEGACY) {
            return false;
        }
        for (Expression operand : logical.operands()) {
            if (operand.accept(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitAggregate(AggregateExpression aggregate) {
        return true;
    }
}
