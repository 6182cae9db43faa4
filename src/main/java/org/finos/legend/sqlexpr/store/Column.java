package org.finos.legend.sqlexpr.store;

import java.util.Objects;

/**
 * Represents a column in a relational table.
 *
 * @param name     The column name
 * @param dataType The column's declared type
 */
public record Column(
        String name,
        AttributeType dataType
) {
    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column dataType cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static Column of(String name, AttributeType dataType) {
        return new Column(name, dataType);
    }
}
