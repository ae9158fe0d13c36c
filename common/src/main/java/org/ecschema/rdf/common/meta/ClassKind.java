package org.ecschema.rdf.common.meta;

/**
 * Kinds of schema items that are mapped as classes.
 */
public enum ClassKind {
    ENTITY_CLASS,
    RELATIONSHIP_CLASS,
    CUSTOM_ATTRIBUTE_CLASS,
    MIXIN,
    ENUMERATION,
    /**
     * Struct classes exist in the metadata model but have no counterpart in
     * the upper vocabulary.
     */
    STRUCT_CLASS
}
