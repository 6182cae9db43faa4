package org.finos.legend.sqlexpr.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The ordered alias bindings of a query.
 *
 * When the same alias is bound more than once, the first binding wins.
 */
public final class AliasBindings {

    private static final AliasBindings EMPTY = new AliasBindings(List.of());

    private final List<AliasBinding> bindings;
    private final Map<String, String> tableByAlias;

    private AliasBindings(List<AliasBinding> bindings) {
        this.bindings = List.copyOf(bindings);
        Map<String, String> index = new LinkedHashMap<>();
        for (AliasBinding binding : this.bindings) {
            index.putIfAbsent(binding.alias(), binding.tableName());
        }
        this.tableByAlias = Collections.unmodifiableMap(index);
    }

    public static AliasBindings empty() {
        return EMPTY;
    }

    public static AliasBindings of(AliasBinding... bindings) {
        return new AliasBindings(List.of(bindings));
    }

    public static AliasBindings of(List<AliasBinding> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        return new AliasBindings(bindings);
    }

    /**
     * Convenience factory for a single binding.
     */
    public static AliasBindings of(String tableName, String alias) {
        return of(new AliasBinding(tableName, alias));
    }

    /**
     * @return The table bound to the first occurrence of the alias
     */
    public Optional<String> resolve(String alias) {
        return Optional.ofNullable(tableByAlias.get(alias));
    }

    public List<AliasBinding> bindings() {
        return bindings;
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
