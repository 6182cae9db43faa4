package org.finos.legend.sqlexpr.store;

/**
 * The declared type of a table attribute, as seen by the expression type checker.
 */
public interface AttributeType {

    /**
     * @return true if values of this type are booleans
     */
    boolean isBoolean();

    /**
     * @return The canonical type name ("int", "double", "string" for the types the
     *         type checker understands; anything else is treated as unrecognized)
     */
    String canonicalName();
}
