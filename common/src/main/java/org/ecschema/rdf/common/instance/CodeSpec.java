package org.ecschema.rdf.common.instance;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named rule for the uniqueness of codes.
 */
@Value
@Builder
@Jacksonized
public class CodeSpec {
    String id;
    String name;
}
