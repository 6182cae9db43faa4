package org.finos.legend.sqlexpr.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitLiteral(Literal literal);

    T visitAttributeReference(AttributeReference reference);

    T visitArithmetic(ArithmeticExpression arithmetic);

    T visitComparison(ComparisonExpression comparison);

    /**
     * Visit an OR / NOT expression.
     */
    T visitLogical(LogicalExpression logical);

    /**
     * Visit an aggregate expression (SUM, AVG).
     */
    T visitAggregate(AggregateExpression aggregate);
}
