package org.ecschema.rdf.common.instance;

import java.util.Map;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.meta.ClassKey;

import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A record of a class: an element, model, aspect or relationship. Values are
 * keyed by property name and include the properties inherited from base
 * classes.
 */
@Getter
@ToString
@SuperBuilder
public abstract class Instance {
    private final String id;
    /**
     * Full name of the class of the instance, Schema:Class or Schema.Class.
     */
    private final String classFullName;
    @Singular
    private final Map<String, Object> properties;

    public ClassKey getClassKey() {
        return ClassKey.parse(classFullName);
    }

    /**
     * Value of a property or null if the instance has none.
     */
    @Nullable
    public Object getPropertyValue(String propertyName) {
        return properties.get(propertyName);
    }
}
