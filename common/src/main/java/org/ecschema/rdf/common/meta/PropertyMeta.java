package org.ecschema.rdf.common.meta;

import java.util.Locale;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A property declared on a class.
 */
@Value
@Builder
@Jacksonized
public class PropertyMeta {
    /**
     * Name, unique among the properties of the declaring class and its
     * bases.
     */
    String name;
    PropertyKind kind;
    /**
     * True for primitive and struct arrays.
     */
    boolean array;
    /**
     * Type of primitive and enumeration properties.
     */
    @Nullable
    PrimitiveType primitiveType;
    /**
     * Free form hint refining the primitive type, see {@link ExtendedTypes}.
     */
    @Nullable
    String extendedTypeName;
    @Nullable
    String description;
    /**
     * Relationship followed by a navigation property.
     */
    @Nullable
    ClassKey relationshipClass;
    @Nullable
    StrengthDirection direction;
    /**
     * Enumeration constraining an enumeration property, null if it could not
     * be resolved when the metadata was loaded.
     */
    @Nullable
    ClassKey enumeration;

    /**
     * Does this property carry the extended type? Case insensitive.
     */
    public boolean hasExtendedType(String extendedType) {
        return extendedTypeName != null
                && extendedTypeName.toLowerCase(Locale.ROOT).equals(extendedType.toLowerCase(Locale.ROOT));
    }

    /**
     * Scalar primitive property.
     */
    public static PropertyMeta primitive(String name, PrimitiveType type) {
        return builder().name(name).kind(PropertyKind.PRIMITIVE).primitiveType(type).build();
    }

    /**
     * Scalar primitive property with an extended type.
     */
    public static PropertyMeta primitive(String name, PrimitiveType type, String extendedTypeName) {
        return builder().name(name).kind(PropertyKind.PRIMITIVE).primitiveType(type)
                .extendedTypeName(extendedTypeName).build();
    }

    /**
     * Scalar navigation property.
     */
    public static PropertyMeta navigation(String name, ClassKey relationshipClass, StrengthDirection direction) {
        return builder().name(name).kind(PropertyKind.NAVIGATION)
                .relationshipClass(relationshipClass).direction(direction).build();
    }
}
