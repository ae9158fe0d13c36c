package org.ecschema.rdf.common.meta;

import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A schema: a namespace of classes and enumerations.
 */
@Value
@Builder
@Jacksonized
public class SchemaRef {
    String name;
    /**
     * Short, unique alias used as the Turtle prefix of the schema.
     */
    String alias;
    /**
     * Version as read/write/minor, e.g. 01.00.10.
     */
    @Nullable
    String version;
    @Nullable
    String description;
    /**
     * Classes and enumerations in declaration order.
     */
    @Singular("classMeta")
    List<ClassMeta> classes;

    /**
     * Full versioned key, e.g. BisCore.01.00.10.
     */
    public String getSchemaKey() {
        return version == null ? name : name + "." + version;
    }
}
