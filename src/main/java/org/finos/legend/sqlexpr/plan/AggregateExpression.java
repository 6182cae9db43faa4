package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents an aggregate over the rows of a group.
 *
 * Example: {@code sum([o_amount])}
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument) implements Expression {

    public enum AggregateFunction {
        SUM("sum"),
        AVG("avg");

        private final String functionName;

        AggregateFunction(String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        Objects.requireNonNull(argument, "Aggregate argument cannot be null");
    }

    public static AggregateExpression sum(Expression argument) {
        return new AggregateExpression(AggregateFunction.SUM, argument);
    }

    public static AggregateExpression avg(Expression argument) {
        return new AggregateExpression(AggregateFunction.AVG, argument);
    }

    @Override
    public List<Expression> children() {
        return List.of(argument);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
