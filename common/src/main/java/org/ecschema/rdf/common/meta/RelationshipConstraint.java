package org.ecschema.rdf.common.meta;

import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Source or target end of a relationship class.
 */
@Value
@Builder
@Jacksonized
public class RelationshipConstraint {
    /**
     * Classes allowed at this end, in declaration order.
     */
    @Singular
    List<ClassKey> constraintClasses;

    /**
     * The class a navigation property resolves to when it has to pick a
     * single type for this end: the first one declared. Multi class
     * constraints are not modeled as unions.
     */
    @Nullable
    public ClassKey defaultClass() {
        return constraintClasses.isEmpty() ? null : constraintClasses.get(0);
    }
}
