package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a boolean OR of two conditions or the negation of one.
 *
 * @param operator The logical operator (OR, NOT)
 * @param operands The operand expressions
 */
public record LogicalExpression(
        LogicalOperator operator,
        List<Expression> operands
) implements Expression {

    public enum LogicalOperator {
        OR("||", 2),
        NOT("!", 1);

        private final String symbol;
        private final int arity;

        LogicalOperator(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String symbol() {
            return symbol;
        }

        public int arity() {
            return arity;
        }
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operands, "Operands cannot be null");

        // Ensure immutability; List.copyOf also rejects null operands
        operands = List.copyOf(operands);

        if (operands.size() != operator.arity()) {
            throw new IllegalArgumentException(
                    operator + " operator requires exactly " + operator.arity() + " operand(s), got " + operands.size());
        }
    }

    public static LogicalExpression or(Expression left, Expression right) {
        return new LogicalExpression(LogicalOperator.OR, List.of(left, right));
    }

    public static LogicalExpression not(Expression expression) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(expression));
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
