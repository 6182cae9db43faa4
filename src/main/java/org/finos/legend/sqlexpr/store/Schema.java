package org.finos.legend.sqlexpr.store;

import java.util.Optional;

/**
 * Maps attribute names to their position and type.
 */
@FunctionalInterface
public interface Schema {

    Optional<AttributeInfo> lookupAttribute(String attributeName);
}
