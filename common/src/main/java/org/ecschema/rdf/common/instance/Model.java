package org.ecschema.rdf.common.instance;

import javax.annotation.Nullable;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * A model, owning a sub-tree of elements.
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Model extends Instance {
    /**
     * Element the model breaks down.
     */
    @Nullable
    private final String modeledElementId;
}
