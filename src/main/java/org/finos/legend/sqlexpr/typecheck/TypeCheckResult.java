package org.finos.legend.sqlexpr.typecheck;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * The inferred type of an expression together with every diagnostic reported while inferring it.
 *
 * @param type        The inferred type; {@link ReturnType#ERROR} if checking failed
 * @param diagnostics Diagnostics in the order they were reported
 */
public record TypeCheckResult(
        ReturnType type,
        ImmutableList<Diagnostic> diagnostics) {

    public TypeCheckResult {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
    }

    public boolean isError() {
        return type.isError();
    }

    public ImmutableList<String> messages() {
        return diagnostics.collect(Diagnostic::message);
    }

    /**
     * @return The inferred type
     * @throws ExpressionTypeException if the expression failed type checking
     */
    public ReturnType orThrow() {
        if (isError()) {
            throw new ExpressionTypeException(diagnostics);
        }
        return type;
    }
}
