package org.finos.legend.sqlexpr.typecheck;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.finos.legend.sqlexpr.plan.AggregateExpression;
import org.finos.legend.sqlexpr.plan.ArithmeticExpression;
import org.finos.legend.sqlexpr.plan.ArithmeticExpression.ArithmeticOperator;
import org.finos.legend.sqlexpr.plan.AttributeReference;
import org.finos.legend.sqlexpr.plan.ComparisonExpression;
import org.finos.legend.sqlexpr.plan.Expression;
import org.finos.legend.sqlexpr.plan.ExpressionDepth;
import org.finos.legend.sqlexpr.plan.ExpressionVisitor;
import org.finos.legend.sqlexpr.plan.Literal;
import org.finos.legend.sqlexpr.plan.LogicalExpression;
import org.finos.legend.sqlexpr.store.AliasBindings;
import org.finos.legend.sqlexpr.store.AttributeInfo;
import org.finos.legend.sqlexpr.store.AttributeType;
import org.finos.legend.sqlexpr.store.Catalog;
import org.finos.legend.sqlexpr.store.Schema;
import org.finos.legend.sqlexpr.typecheck.Diagnostic.Category;

import java.util.Objects;
import java.util.Optional;

/**
 * Infers the {@link ReturnType} of an expression tree and validates operand
 * compatibility against a catalog and the query's alias bindings.
 *
 * Each node checks all of its children first, so that the diagnostics of
 * every failing sub-expression are reported. A node with an erroneous child is
 * itself erroneous and does not apply its own rule. Only attribute references
 * consult the catalog and alias bindings; every other rule is structural.
 *
 * Rules:
 * - literals: their own kind
 * - attribute: alias, then table, then attribute lookup; bool/int/double/string by attribute type
 * - + : string on either side concatenates to string; bool is an error
 * - - * / : string or bool is an error; / always yields double
 * - int op int yields int, otherwise double
 * - comparisons: string with string, or numeric with numeric, yields bool
 * - OR / NOT: bool operands only
 * - SUM keeps its numeric argument type, AVG yields double
 *
 * Instances are immutable and may be shared between threads as long as the
 * catalog is not mutated concurrently.
 */
public final class ExpressionTypeChecker {

    private final Catalog catalog;
    private final AliasBindings aliasBindings;
    private final TypeCheckOptions options;

    public ExpressionTypeChecker(Catalog catalog, AliasBindings aliasBindings) {
        this(catalog, aliasBindings, TypeCheckOptions.defaults());
    }

    public ExpressionTypeChecker(Catalog catalog, AliasBindings aliasBindings, TypeCheckOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.aliasBindings = Objects.requireNonNull(aliasBindings, "Alias bindings cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * Type checks an expression tree.
     *
     * @param expression The root of the tree
     * @return The inferred type and the diagnostics reported along the way
     */
    public TypeCheckResult check(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Inference inference = new Inference();

        if (ExpressionDepth.exceeds(expression, options.maxDepth())) {
            inference.report(new Diagnostic(Category.DEPTH_EXCEEDED,
                    "Expression nesting exceeds the maximum depth of " + options.maxDepth(), null));
            return new TypeCheckResult(ReturnType.ERROR, inference.diagnostics.toImmutable());
        }

        ReturnType type = expression.accept(inference);
        return new TypeCheckResult(type, inference.diagnostics.toImmutable());
    }

    // ==================== Inference ====================

    /**
     * One traversal. Holds the diagnostics of a single {@link #check} call.
     */
    private final class Inference implements ExpressionVisitor<ReturnType> {

        private final MutableList<Diagnostic> diagnostics = Lists.mutable.empty();

        private void report(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            options.listener().report(diagnostic);
        }

        private ReturnType fail(Category category, String message, Expression expression) {
            report(new Diagnostic(category, message, expression.render()));
            return ReturnType.ERROR;
        }

        @Override
        public ReturnType visitLiteral(Literal literal) {
            return switch (literal.literalType()) {
                case BOOLEAN -> ReturnType.BOOL;
                case INTEGER -> ReturnType.INT;
                case DOUBLE -> ReturnType.DOUBLE;
                case STRING -> ReturnType.STRING;
            };
        }

        @Override
        public ReturnType visitAttributeReference(AttributeReference reference) {
            Optional<String> tableName = aliasBindings.resolve(reference.alias());
            if (tableName.isEmpty()) {
                return fail(Category.UNRESOLVED_ALIAS,
                        "Table alias '" + reference.alias() + "' not found in query", reference);
            }

            Optional<Schema> schema = catalog.lookupTable(tableName.get());
            if (schema.isEmpty()) {
                return fail(Category.UNRESOLVED_TABLE,
                        "Table '" + tableName.get() + "' not found in catalog", reference);
            }

            Optional<AttributeInfo> attribute = schema.get().lookupAttribute(reference.attributeName());
            if (attribute.isEmpty()) {
                return fail(Category.UNRESOLVED_ATTRIBUTE,
                        "Attribute '" + reference.attributeName() + "' not found in table '" + tableName.get() + "'",
                        reference);
            }

            AttributeType attributeType = attribute.get().type();
            if (attributeType.isBoolean()) {
                return ReturnType.BOOL;
            }
            String typeName = attributeType.canonicalName();
            if ("int".equals(typeName)) {
                return ReturnType.INT;
            }
            if ("double".equals(typeName)) {
                return ReturnType.DOUBLE;
            }
            if ("string".equals(typeName)) {
                return ReturnType.STRING;
            }
            return fail(Category.UNRECOGNIZED_ATTRIBUTE_TYPE,
                    "Attribute '" + reference.attributeName() + "' of table '" + tableName.get()
                            + "' has unrecognized type '" + typeName + "'",
                    reference);
        }

        @Override
        public ReturnType visitArithmetic(ArithmeticExpression arithmetic) {
            ReturnType left = arithmetic.left().accept(this);
            ReturnType right = arithmetic.right().accept(this);
            if (left.isError() || right.isError()) {
                return ReturnType.ERROR;
            }

            ArithmeticOperator operator = arithmetic.operator();
            if (left == ReturnType.STRING || right == ReturnType.STRING) {
                // + concatenates the string form of the other operand
                if (operator == ArithmeticOperator.PLUS) {
                    return ReturnType.STRING;
                }
                return fail(Category.INCOMPATIBLE_OPERANDS,
                        operandMessage(operator, "string", left, right), arithmetic);
            }
            if (left == ReturnType.BOOL || right == ReturnType.BOOL) {
                return fail(Category.INCOMPATIBLE_OPERANDS,
                        operandMessage(operator, "bool", left, right), arithmetic);
            }

            if (operator == ArithmeticOperator.DIVIDE) {
                return ReturnType.DOUBLE;
            }
            if (left == ReturnType.INT && right == ReturnType.INT) {
                return ReturnType.INT;
            }
            return ReturnType.DOUBLE;
        }

        @Override
        public ReturnType visitComparison(ComparisonExpression comparison) {
            ReturnType left = comparison.left().accept(this);
            ReturnType right = comparison.right().accept(this);
            if (left.isError() || right.isError()) {
                return ReturnType.ERROR;
            }

            if (left == ReturnType.STRING || right == ReturnType.STRING) {
                if (left == right) {
                    return ReturnType.BOOL;
                }
            } else if (left.isNumeric() && right.isNumeric()) {
                return ReturnType.BOOL;
            }

            return fail(Category.INCOMPATIBLE_OPERANDS,
                    "Cannot compare incompatible types: left=" + left.typeName() + ", right=" + right.typeName()
                            + " (operator '" + comparison.operator().symbol() + "')",
                    comparison);
        }

        @Override
        public ReturnType visitLogical(LogicalExpression logical) {
            MutableList<ReturnType> operandTypes = Lists.mutable.empty();
            for (Expression operand : logical.operands()) {
                operandTypes.add(operand.accept(this));
            }
            if (operandTypes.anySatisfy(ReturnType::isError)) {
                return ReturnType.ERROR;
            }
            if (operandTypes.allSatisfy(type -> type == ReturnType.BOOL)) {
                return ReturnType.BOOL;
            }

            if (logical.operator() == LogicalExpression.LogicalOperator.NOT) {
                return fail(Category.INCOMPATIBLE_OPERANDS,
                        "NOT operator requires a boolean expression, but got type " + operandTypes.get(0).typeName(),
                        logical);
            }
            return fail(Category.INCOMPATIBLE_OPERANDS,
                    "OR operator requires boolean operands, but got " + operandTypes.get(0).typeName()
                            + " and " + operandTypes.get(1).typeName(),
                    logical);
        }

        @Override
        public ReturnType visitAggregate(AggregateExpression aggregate) {
            ReturnType argument = aggregate.argument().accept(this);
            if (argument.isError()) {
                return ReturnType.ERROR;
            }
            if (!argument.isNumeric()) {
                return fail(Category.INCOMPATIBLE_OPERANDS,
                        "Cannot apply " + aggregate.function() + " to non-numeric expression: "
                                + aggregate.argument().render(),
                        aggregate);
            }

            return switch (aggregate.function()) {
                case SUM -> argument;
                case AVG -> ReturnType.DOUBLE;
            };
        }

        private String operandMessage(ArithmeticOperator operator, String offendingType,
                                      ReturnType left, ReturnType right) {
            return "Cannot " + operator.verb() + " " + offendingType + " values: left=" + left.typeName()
                    + ", right=" + right.typeName() + " (operator '" + operator.symbol() + "')";
        }
    }
}
