package org.ecschema.rdf.common.meta;

/**
 * Primitive types of the metadata model.
 */
public enum PrimitiveType {
    /**
     * Zero value of the source model, never valid on a mapped property.
     */
    UNINITIALIZED,
    BINARY,
    BOOLEAN,
    DATE_TIME,
    DOUBLE,
    /**
     * Opaque geometry, referenced but never decoded.
     */
    GEOMETRY,
    INTEGER,
    LONG,
    POINT_2D,
    POINT_3D,
    STRING
}
