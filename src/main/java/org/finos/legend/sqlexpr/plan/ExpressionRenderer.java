package org.finos.legend.sqlexpr.plan;

import java.math.BigDecimal;

/**
 * Renders an expression tree to its canonical string form, used for plan
 * display and in diagnostics.
 *
 * <pre>
 *   int[5]  double[2.5]  string[abc]  bool[true]  [o_amount]
 *   + (L, R)  &gt; (L, R)  || (L, R)  !(C)  sum(C)
 * </pre>
 *
 * Finite doubles render in plain decimal notation ({@code double[100000000000000000000]},
 * never {@code 1.0E20}); NaN and the infinities render as {@link Double#toString}.
 * Rendering recurses once per level of nesting.
 */
public final class ExpressionRenderer implements ExpressionVisitor<String> {

    public static final ExpressionRenderer INSTANCE = new ExpressionRenderer();

    private ExpressionRenderer() {
    }

    @Override
    public String visitLiteral(Literal literal) {
        return literal.literalType().renderName() + "[" + renderValue(literal.value()) + "]";
    }

    private static String renderValue(Object value) {
        String text = String.valueOf(value);
        if (value instanceof Double d && Double.isFinite(d) && text.indexOf('E') >= 0) {
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return text;
    }

    @Override
    public String visitAttributeReference(AttributeReference reference) {
        return "[" + reference.alias() + "_" + reference.attributeName() + "]";
    }

    @Override
    public String visitArithmetic(ArithmeticExpression arithmetic) {
        return binary(arithmetic.operator().symbol(), arithmetic.left(), arithmetic.right());
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        return binary(comparison.operator().symbol(), comparison.left(), comparison.right());
    }

    @Override
    public String visitLogical(LogicalExpression logical) {
        if (logical.operator() == LogicalExpression.LogicalOperator.NOT) {
            return "!(" + logical.operands().get(0).accept(this) + ")";
        }
        return binary(logical.operator().symbol(), logical.operands().get(0), logical.operands().get(1));
    }

    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        return aggregate.function().functionName() + "(" + aggregate.argument().accept(this) + ")";
    }

    private String binary(String symbol, Expression left, Expression right) {
        return symbol + " (" + left.accept(this) + ", " + right.accept(this) + ")";
    }
}
