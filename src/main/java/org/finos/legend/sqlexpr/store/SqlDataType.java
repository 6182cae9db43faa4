package org.finos.legend.sqlexpr.store;

/**
 * Represents SQL data types for relational columns.
 */
public enum SqlDataType implements AttributeType {
    VARCHAR("string"),
    INTEGER("int"),
    DOUBLE("double"),
    BOOLEAN("bool"),
    DATE("date"),
    TIMESTAMP("timestamp");

    private final String canonicalName;

    SqlDataType(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    @Override
    public boolean isBoolean() {
        return this == BOOLEAN;
    }

    @Override
    public String canonicalName() {
        return canonicalName;
    }
}
