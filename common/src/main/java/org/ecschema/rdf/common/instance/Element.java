package org.ecschema.rdf.common.instance;

import javax.annotation.Nullable;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * An element (entity) of a model.
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Element extends Instance {
    /**
     * Model containing the element.
     */
    @Nullable
    private final String modelId;
    @Nullable
    private final String parentId;
    @Nullable
    private final Code code;
}
