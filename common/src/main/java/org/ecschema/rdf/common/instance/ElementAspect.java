package org.ecschema.rdf.common.instance;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * A unique or multi aspect, owned by exactly one element.
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class ElementAspect extends Instance {
    private final String elementId;
}
