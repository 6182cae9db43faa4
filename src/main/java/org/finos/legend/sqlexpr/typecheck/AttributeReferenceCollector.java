package org.finos.legend.sqlexpr.typecheck;

import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.set.MutableSet;
import org.finos.legend.sqlexpr.plan.AggregateExpression;
import org.finos.legend.sqlexpr.plan.ArithmeticExpression;
import org.finos.legend.sqlexpr.plan.AttributeReference;
import org.finos.legend.sqlexpr.plan.ComparisonExpression;
import org.finos.legend.sqlexpr.plan.Expression;
import org.finos.legend.sqlexpr.plan.ExpressionVisitor;
import org.finos.legend.sqlexpr.plan.Literal;
import org.finos.legend.sqlexpr.plan.LogicalExpression;

import java.util.Objects;
import java.util.Set;

/**
 * Gathers the attribute references an expression depends on.
 */
public final class AttributeReferenceCollector {

    public static final AttributeReferenceCollector LEGACY = new AttributeReferenceCollector(PropagationMode.LEGACY);
    public static final AttributeReferenceCollector FULL = new AttributeReferenceCollector(PropagationMode.FULL);

    private final PropagationMode mode;

    private AttributeReferenceCollector(PropagationMode mode) {
        this.mode = Objects.requireNonNull(mode);
    }

    public static AttributeReferenceCollector forMode(PropagationMode mode) {
        return mode == PropagationMode.FULL ? FULL : LEGACY;
    }

    /**
     * Adds the references reachable from {@code expression} to {@code references}.
     */
    public void collect(Expression expression, Set<AttributeReference> references) {
        Objects.requireNonNull(references, "References cannot be null");
        expression.accept(new Collector(references));
    }

    public MutableSet<AttributeReference> collect(Expression expression) {
        MutableSet<AttributeReference> references = Sets.mutable.empty();
        collect(expression, references);
        return references;
    }

    private final class Collector implements ExpressionVisitor<Void> {

        private final Set<AttributeReference> references;

        private Collector(Set<AttributeReference> references) {
            this.references = references;
        }

        @Override
        public Void visitLiteral(Literal literal) {
            return null;
        }

        @Override
        public Void visitAttributeReference(AttributeReference reference) {
            references.add(reference);
            return null;
        }

        @Override
        public Void visitArithmetic(ArithmeticExpression arithmetic) {
            arithmetic.left().accept(this);
            arithmetic.right().accept(this);
            return null;
        }

        @Override
        public Void visitComparison(ComparisonExpression comparison) {
            if (mode == PropagationMode.FULL) {
                comparison.left().accept(this);
                comparison.right().accept(this);
            }
            return null;
        }

        @Override
        public Void visitLogical(LogicalExpression logical) {
            if (mode == PropagationMode.FULL) {
                logical.operands().forEach(operand -> operand.accept(this));
            }
            return null;
        }

        @Override
        public Void visitAggregate(AggregateExpression aggregate) {
            aggregate.argument().accept(this);
            return null;
        }
    }
}
