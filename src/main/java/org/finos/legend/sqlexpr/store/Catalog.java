package org.finos.legend.sqlexpr.store;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of table schemas, keyed by canonical table name.
 */
@FunctionalInterface
public interface Catalog {

    Optional<Schema> lookupTable(String tableName);

    static Catalog empty() {
        return tableName -> Optional.empty();
    }

    static Catalog of(Table... tables) {
        return of(List.of(tables));
    }

    /**
     * Creates an immutable catalog over the given tables.
     *
     * @throws IllegalArgumentException if two tables share a name
     */
    static Catalog of(Collection<Table> tables) {
        Map<String, Schema> byName = new LinkedHashMap<>();
        for (Table table : tables) {
            if (byName.putIfAbsent(table.name(), table) != null) {
                throw new IllegalArgumentException("Duplicate table in catalog: " + table.name());
            }
        }
        Map<String, Schema> frozen = Map.copyOf(byName);
        return tableName -> Optional.ofNullable(frozen.get(tableName));
    }
}
