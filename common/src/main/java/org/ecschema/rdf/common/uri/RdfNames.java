package org.ecschema.rdf.common.uri;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

/**
 * Formats the prefixed names of exported classes, properties and instances.
 * Names are stable: the same input always formats to the same name and
 * distinct inputs never collide as long as schema aliases are unique and
 * class names don't contain a hyphen.
 */
public final class RdfNames {
    /**
     * Separates a class RDF name from a property name in property RDF names.
     */
    public static final char PROPERTY_SEPARATOR = '-';
    /**
     * Separates a class RDF name from a property name in property labels.
     */
    public static final char LABEL_SEPARATOR = '.';

    /**
     * Class RDF name, alias:ClassName.
     */
    public static String formatClassName(String schemaAlias, String className) {
        checkArgument(!Strings.isNullOrEmpty(schemaAlias), "Schema alias is required for class %s", className);
        checkArgument(!Strings.isNullOrEmpty(className), "Class name is required in schema %s", schemaAlias);
        return schemaAlias + ':' + className;
    }

    /**
     * Property RDF name, alias:ClassName-PropertyName.
     */
    public static String formatPropertyName(String classRdfName, String propertyName) {
        checkArgument(!Strings.isNullOrEmpty(classRdfName), "Class RDF name is required for property %s", propertyName);
        checkArgument(!Strings.isNullOrEmpty(propertyName), "Property name is required on %s", classRdfName);
        return classRdfName + PROPERTY_SEPARATOR + propertyName;
    }

    /**
     * Property label, alias:ClassName.PropertyName.
     */
    public static String formatPropertyLabel(String classRdfName, String propertyName) {
        return classRdfName + LABEL_SEPARATOR + propertyName;
    }

    /**
     * Instance RDF name, e.g. elementId:e0x1d.
     */
    public static String formatInstanceId(InstancePrefix prefix, String id) {
        checkArgument(!Strings.isNullOrEmpty(id), "Id is required for %s", prefix);
        return prefix.prefix() + ':' + prefix.tag() + id;
    }

    private RdfNames() {
        // Utility class.
    }
}
