package org.finos.legend.sqlexpr.typecheck;

/**
 * Receives diagnostics as soon as the type checker produces them.
 * Diagnostics are also returned in the {@link TypeCheckResult}; a listener is only
 * needed to stream them somewhere.
 */
@FunctionalInterface
public interface DiagnosticListener {

    DiagnosticListener NONE = diagnostic -> {
    };

    DiagnosticListener STANDARD_ERROR = diagnostic -> System.err.println("ERROR: " + diagnostic.message());

    void report(Diagnostic diagnostic);
}
