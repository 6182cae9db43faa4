package org.finos.legend.sqlexpr.store;

import java.util.Objects;

/**
 * Binds an alias to a table within one query's FROM clause.
 *
 * @param tableName The canonical table name
 * @param alias     The alias used by attribute references
 */
public record AliasBinding(String tableName, String alias) {

    public AliasBinding {
        Objects.requireNonNull(tableName, "Table name cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
    }
}
