package org.ecschema.rdf.common.instance;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * An instance of a link table relationship class.
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Relationship extends Instance {
    private final String sourceId;
    private final String targetId;
}
