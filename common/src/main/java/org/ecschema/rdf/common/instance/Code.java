package org.ecschema.rdf.common.instance;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Strings;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Human meaningful name of an element, unique within its spec and scope.
 */
@Value
@Builder
@Jacksonized
public class Code {
    /**
     * Id of the code specification.
     */
    String spec;
    /**
     * Id of the element the code is unique within.
     */
    String scope;
    /**
     * The name itself, empty when the element has no code.
     */
    @Nullable
    String value;

    @JsonIgnore
    public boolean isEmpty() {
        return Strings.isNullOrEmpty(value);
    }
}
