package org.ecschema.rdf.common.uri;

/**
 * Constants for the <a href="https://www.w3.org/TR/rdf11-concepts/#dfn-rdf-compatible-xsd-types">RDF
 * compatible XSD types</a> the primitive properties map to.
 */
public final class XSD {
    /**
     * Prefix bound to the XSD namespace in the output.
     */
    public static final String PREFIX = "xsd";
    /**
     * Namespace for XSD.
     */
    public static final String NAMESPACE = "http://www.w3.org/2001/XMLSchema#";
    /**
     * Range of binary properties without a recognized extended type.
     */
    public static final String BASE64_BINARY = PREFIX + ":base64Binary";
    public static final String BOOLEAN = PREFIX + ":boolean";
    public static final String DATE_TIME = PREFIX + ":dateTime";
    public static final String DOUBLE = PREFIX + ":double";
    public static final String INTEGER = PREFIX + ":integer";
    public static final String LONG = PREFIX + ":long";
    /**
     * Range of string properties and the parent of the string-like ec: types.
     */
    public static final String STRING = PREFIX + ":string";

    /**
     * Utility class uncallable constructor.
     */
    private XSD() {
        // Utility class.
    }
}
