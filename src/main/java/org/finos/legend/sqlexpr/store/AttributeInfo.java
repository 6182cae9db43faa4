package org.finos.legend.sqlexpr.store;

import java.util.Objects;

/**
 * Position and type of an attribute within a table schema.
 *
 * @param position The zero-based ordinal of the attribute
 * @param type     The attribute type
 */
public record AttributeInfo(int position, AttributeType type) {

    public AttributeInfo {
        Objects.requireNonNull(type, "Attribute type cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("Attribute position cannot be negative: " + position);
        }
    }
}
