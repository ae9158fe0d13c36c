package org.ecschema.rdf.common.uri;

/**
 * Constants for <a href="http://www.w3.org/TR/rdf11-concepts/">RDF
 * primitives</a> and for the RDF namespace. Terms are kept in their prefixed
 * form since that is how they are written to the Turtle output.
 */
public final class RDF {
    /**
     * Prefix bound to the RDF namespace in the output.
     */
    public static final String PREFIX = "rdf";
    /**
     * Common prefix for all RDF predicates.
     */
    public static final String NAMESPACE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    /**
     * Predicate representing the type of a thing. Every exported instance gets
     * exactly one of these.
     */
    public static final String TYPE = PREFIX + ":type";
    /**
     * Root of all properties, the upper vocabulary's ec:Property derives from it.
     */
    public static final String PROPERTY = PREFIX + ":Property";
    /**
     * Ordered list. Used as the range of array properties.
     */
    public static final String LIST = PREFIX + ":List";

    /**
     * Utility class uncallable constructor.
     */
    private RDF() {
        // Utility class.
    }
}
