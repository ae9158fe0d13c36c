package org.ecschema.rdf.common.meta;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A class, relationship class, mixin, custom attribute class or enumeration
 * of a schema. Relationship classes additionally carry their source and
 * target constraints.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ClassMeta {
    /**
     * Custom attribute marking relationships that have their own link table.
     * Relationships without it anywhere up to their root are navigation only.
     */
    public static final String LINK_TABLE_RELATIONSHIP_MAP = "ECDbMap.LinkTableRelationshipMap";

    String name;
    ClassKind kind;
    /**
     * Single base class, null for root classes.
     */
    @Nullable
    ClassKey baseClass;
    /**
     * Display label, the RDF name is used when missing.
     */
    @Nullable
    String label;
    @Nullable
    String description;
    /**
     * Properties declared on this class only, inherited ones live on their
     * declaring class.
     */
    @Singular
    List<PropertyMeta> properties;
    /**
     * Full names of the custom attributes applied to the class.
     */
    @Singular
    Set<String> customAttributes;
    @Nullable
    RelationshipConstraint source;
    @Nullable
    RelationshipConstraint target;

    public boolean hasCustomAttribute(String fullName) {
        return customAttributes.contains(fullName);
    }
}
