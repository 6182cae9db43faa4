package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a binary arithmetic expression.
 *
 * Supports: +, -, *, /
 *
 * @param left     The left operand
 * @param operator The arithmetic operator
 * @param right    The right operand
 */
public record ArithmeticExpression(
        Expression left,
        ArithmeticOperator operator,
        Expression right) implements Expression {

    public enum ArithmeticOperator {
        PLUS("+", "add"),
        MINUS("-", "subtract"),
        TIMES("*", "multiply"),
        DIVIDE("/", "divide");

        private final String symbol;
        private final String verb;

        ArithmeticOperator(String symbol, String verb) {
            this.symbol = symbol;
            this.verb = verb;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * @return The verb used in diagnostics, e.g. "subtract"
         */
        public String verb() {
            return verb;
        }
    }

    public ArithmeticExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ArithmeticExpression plus(Expression left, Expression right) {
        return new ArithmeticExpression(left, ArithmeticOperator.PLUS, right);
    }

    public static ArithmeticExpression minus(Expression left, Expression right) {
        return new ArithmeticExpression(left, ArithmeticOperator.MINUS, right);
    }

    public static ArithmeticExpression times(Expression left, Expression right) {
        return new ArithmeticExpression(left, ArithmeticOperator.TIMES, right);
    }

    public static ArithmeticExpression divide(Expression left, Expression right) {
        return new ArithmeticExpression(left, ArithmeticOperator.DIVIDE, right);
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
