package org.ecschema.rdf.common.uri;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The upper vocabulary every exported schema subclasses into. These names
 * have not been finalized so consumers should only rely on the hierarchy
 * declared by the exporter, not on the namespace.
 */
public final class EC {
    /**
     * Prefix bound to the upper vocabulary namespace in the output.
     */
    public static final String PREFIX = "ec";
    /**
     * Default namespace of the upper vocabulary.
     */
    public static final String NAMESPACE = "http://www.example.org/ec#";

    /**
     * Abstract root of all mapped classes.
     */
    public static final String CLASS = PREFIX + ":Class";
    public static final String ENTITY_CLASS = PREFIX + ":EntityClass";
    public static final String RELATIONSHIP_CLASS = PREFIX + ":RelationshipClass";
    public static final String CUSTOM_ATTRIBUTE_CLASS = PREFIX + ":CustomAttributeClass";
    /**
     * Parent of enumerations. Derives directly from rdfs:Class and not from
     * ec:Class since enumerations have no instances of their own.
     */
    public static final String ENUMERATION = PREFIX + ":Enumeration";
    /**
     * Opaque geometry, never decoded by the exporter.
     */
    public static final String IGEOMETRY = PREFIX + ":IGeometry";
    public static final String MIXIN = PREFIX + ":Mixin";
    /**
     * Abstract root of all mapped properties.
     */
    public static final String PROPERTY = PREFIX + ":Property";
    public static final String PRIMITIVE_PROPERTY = PREFIX + ":PrimitiveProperty";
    public static final String STRUCT_PROPERTY = PREFIX + ":StructProperty";
    public static final String PRIMITIVE_ARRAY_PROPERTY = PREFIX + ":PrimitiveArrayProperty";
    public static final String STRUCT_ARRAY_PROPERTY = PREFIX + ":StructArrayProperty";
    public static final String NAVIGATION_PROPERTY = PREFIX + ":NavigationProperty";
    /**
     * Points are written as JSON strings, see {@link #JSON_STRING}.
     */
    public static final String POINT_2D = PREFIX + ":Point2d";
    public static final String POINT_3D = PREFIX + ":Point3d";
    public static final String EXTENDED_TYPE = PREFIX + ":ExtendedType";
    /**
     * Instance identifier, written as a hexadecimal string.
     */
    public static final String ID64_STRING = PREFIX + ":Id64String";
    /**
     * String holding a JSON document.
     */
    public static final String JSON_STRING = PREFIX + ":JsonString";
    public static final String GUID_STRING = PREFIX + ":GuidString";

    /**
     * Every term of the vocabulary in declaration order. Each of them gets a
     * label when the vocabulary is declared.
     */
    public static final List<String> TERMS = ImmutableList.of(
            CLASS, ENTITY_CLASS, RELATIONSHIP_CLASS, CUSTOM_ATTRIBUTE_CLASS, ENUMERATION, IGEOMETRY, MIXIN,
            PROPERTY, PRIMITIVE_PROPERTY, STRUCT_PROPERTY, PRIMITIVE_ARRAY_PROPERTY, STRUCT_ARRAY_PROPERTY,
            NAVIGATION_PROPERTY, POINT_2D, POINT_3D, EXTENDED_TYPE, ID64_STRING, JSON_STRING, GUID_STRING);

    /**
     * Utility class uncallable constructor.
     */
    private EC() {
        // Utility class.
    }
}
