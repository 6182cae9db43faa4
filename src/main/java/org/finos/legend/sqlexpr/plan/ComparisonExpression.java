package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a comparison expression (e.g. {@code [o_amount] > 5}).
 *
 * @param left     The left operand
 * @param operator The comparison operator
 * @param right    The right operand
 */
public record ComparisonExpression(
        Expression left,
        ComparisonOperator operator,
        Expression right
) implements Expression {

    public enum ComparisonOperator {
        GREATER_THAN(">"),
        LESS_THAN("<"),
        EQUALS("=="),
        NOT_EQUALS("!=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ComparisonExpression greaterThan(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.GREATER_THAN, right);
    }

    public static ComparisonExpression lessThan(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.LESS_THAN, right);
    }

    public static ComparisonExpression equalTo(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.EQUALS, right);
    }

    public static ComparisonExpression notEqualTo(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.NOT_EQUALS, right);
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
