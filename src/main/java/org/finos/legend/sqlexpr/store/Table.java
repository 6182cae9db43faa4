package org.finos.legend.sqlexpr.store;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Represents a relational table registered in a {@link Catalog}.
 * An attribute's position is the index of its column.
 *
 * @param name    The canonical table name
 * @param columns Immutable list of columns
 */
public record Table(
        String name,
        List<Column> columns
) implements Schema {

    public Table {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }

        // Ensure immutability
        columns = List.copyOf(columns);

        Set<String> seen = new HashSet<>();
        for (Column column : columns) {
            if (!seen.add(column.name())) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.name() + "' in table " + name);
            }
        }
    }

    public static Table of(String name, Column... columns) {
        return new Table(name, List.of(columns));
    }

    @Override
    public Optional<AttributeInfo> lookupAttribute(String attributeName) {
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (column.name().equals(attributeName)) {
                return Optional.of(new AttributeInfo(i, column.dataType()));
            }
        }
        return Optional.empty();
    }
}
