package org.ecschema.rdf.common.meta;

/**
 * Kind of value a property holds. Whether the property is an array is
 * carried separately by {@link PropertyMeta#isArray()}.
 */
public enum PropertyKind {
    PRIMITIVE,
    STRUCT,
    NAVIGATION,
    /**
     * Primitive property whose values are constrained by an enumeration.
     */
    ENUMERATION
}
