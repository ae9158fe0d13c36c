package org.ecschema.rdf.common.meta;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import lombok.Value;

/**
 * Reference to a class by schema name and class name. Classes never point at
 * each other directly, they go through a {@link SchemaRegistry} with one of
 * these.
 */
@Value
public class ClassKey {
    private static final Splitter FULL_NAME_SPLITTER = Splitter.on(CharMatcher.anyOf(":.")).limit(2);

    String schemaName;
    String name;

    /**
     * Parse a full class name, either Schema:Class or Schema.Class.
     */
    @JsonCreator
    public static ClassKey parse(String fullName) {
        List<String> parts = FULL_NAME_SPLITTER.splitToList(fullName);
        checkArgument(parts.size() == 2 && !parts.get(0).isEmpty() && !parts.get(1).isEmpty(),
                "Invalid full class name: %s", fullName);
        return new ClassKey(parts.get(0), parts.get(1));
    }

    public static ClassKey of(String schemaName, String name) {
        return new ClassKey(schemaName, name);
    }

    @JsonValue
    public String getFullName() {
        return schemaName + ":" + name;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
