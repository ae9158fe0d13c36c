package org.ecschema.rdf.common.instance;

import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * Value of a navigation property: the id of the related element and,
 * optionally, the relationship class linking to it.
 */
@Value
public class RelatedElement {
    @JsonProperty
    String id;
    @Nullable
    @JsonProperty
    String relClassName;

    /**
     * Extract the related id from a property value. Accepts a
     * {@link RelatedElement}, a map with an id entry, a hexadecimal id string
     * or a number.
     *
     * @return the id, or {@link Id64#INVALID} if none can be found
     */
    public static String idFromValue(@Nullable Object value) {
        if (value instanceof RelatedElement) {
            return idFromValue(((RelatedElement) value).getId());
        }
        if (value instanceof Map) {
            return idFromValue(((Map<?, ?>) value).get("id"));
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number) {
            return Id64.fromLong(((Number) value).longValue());
        }
        return Id64.INVALID;
    }
}
