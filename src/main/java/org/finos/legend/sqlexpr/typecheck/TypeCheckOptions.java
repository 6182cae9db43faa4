package org.finos.legend.sqlexpr.typecheck;

import java.util.Objects;

/**
 * Options for {@link ExpressionTypeChecker}.
 *
 * @param maxDepth Deepest expression tree that will be traversed
 * @param listener Receives each diagnostic as it is produced
 */
public record TypeCheckOptions(
        int maxDepth,
        DiagnosticListener listener) {

    public static final int DEFAULT_MAX_DEPTH = 4096;

    private static final TypeCheckOptions DEFAULTS =
            new TypeCheckOptions(DEFAULT_MAX_DEPTH, DiagnosticListener.NONE);

    public TypeCheckOptions {
        Objects.requireNonNull(listener, "Listener cannot be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public static TypeCheckOptions defaults() {
        return DEFAULTS;
    }

    public TypeCheckOptions withMaxDepth(int maxDepth) {
        return new TypeCheckOptions(maxDepth, listener);
    }

    public TypeCheckOptions withListener(DiagnosticListener listener) {
        return new TypeCheckOptions(maxDepth, listener);
    }
}
