package org.finos.legend.sqlexpr.typecheck;

/**
 * The result domain of expression type inference.
 * {@link #ERROR} is absorbing: an expression with an erroneous sub-expression is itself erroneous.
 */
public enum ReturnType {
    STRING("string"),
    INT("int"),
    DOUBLE("double"),
    BOOL("bool"),
    ERROR("error");

    private final String typeName;

    ReturnType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return The lower-case name used in diagnostics
     */
    public String typeName() {
        return typeName;
    }

    public boolean isNumeric() {
        return this == INT || this == DOUBLE;
    }

    public boolean isError() {
        return this == ERROR;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
