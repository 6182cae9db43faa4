package org.finos.legend.sqlexpr.typecheck;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Exception thrown when a caller requires a well-typed expression and type checking failed.
 */
public class ExpressionTypeException extends RuntimeException {

    private final ImmutableList<Diagnostic> diagnostics;

    public ExpressionTypeException(ImmutableList<Diagnostic> diagnostics) {
        super(buildMessage(diagnostics));
        this.diagnostics = diagnostics;
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(ImmutableList<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "Expression failed type checking";
        }
        return "Expression failed type checking: " + diagnostics.collect(Diagnostic::message).makeString("; ");
    }
}
