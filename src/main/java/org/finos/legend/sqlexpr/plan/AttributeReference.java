package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a reference to an attribute of a table bound in the query's FROM clause.
 *
 * @param alias         The table alias
 * @param attributeName The attribute name
 */
public record AttributeReference(
        String alias,
        String attributeName) implements Expression {

    public AttributeReference {
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(attributeName, "Attribute name cannot be null");
    }

    public static AttributeReference of(String alias, String attributeName) {
        return new AttributeReference(alias, attributeName);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAttributeReference(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
