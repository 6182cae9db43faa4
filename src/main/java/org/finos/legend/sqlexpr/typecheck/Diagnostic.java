package org.finos.legend.sqlexpr.typecheck;

import java.util.Objects;

/**
 * A type-checking failure.
 *
 * @param category   What kind of failure this is
 * @param message    Human-readable description naming the operator, types or names involved
 * @param expression Rendered form of the offending expression; null when the tree was not traversed
 */
public record Diagnostic(
        Category category,
        String message,
        String expression) {

    public enum Category {
        UNRESOLVED_ALIAS,
        UNRESOLVED_TABLE,
        UNRESOLVED_ATTRIBUTE,
        UNRECOGNIZED_ATTRIBUTE_TYPE,
        INCOMPATIBLE_OPERANDS,
        DEPTH_EXCEEDED
    }

    public Diagnostic {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    @Override
    public String toString() {
        return expression == null ? message : message + " in " + expression;
    }
}
