package org.ecschema.rdf.common.uri;

/**
 * Constants for the <a href="http://www.w3.org/TR/rdf-schema/">RDF Vocabulary
 * Description Language 1.0: RDF Schema</a> (RDFS).
 */
public final class RDFS {
    /**
     * Prefix bound to the RDFS namespace in the output.
     */
    public static final String PREFIX = "rdfs";
    /**
     * Namespace for RDFS.
     */
    public static final String NAMESPACE = "http://www.w3.org/2000/01/rdf-schema#";
    /**
     * Root of all classes, the upper vocabulary's ec:Class derives from it.
     */
    public static final String CLASS = PREFIX + ":Class";
    /**
     * Links a class or a property to its parent.
     */
    public static final String SUB_CLASS_OF = PREFIX + ":subClassOf";
    /**
     * Class of literal values.
     */
    public static final String LITERAL = PREFIX + ":Literal";
    /**
     * Human readable name of a resource.
     */
    public static final String LABEL = PREFIX + ":label";
    /**
     * Human readable description of a resource.
     */
    public static final String COMMENT = PREFIX + ":comment";
    /**
     * Type of the values of a property.
     */
    public static final String RANGE = PREFIX + ":range";
    /**
     * Class declaring a property.
     */
    public static final String DOMAIN = PREFIX + ":domain";

    /**
     * Utility class uncallable constructor.
     */
    private RDFS() {
        // Utility class.
    }
}
