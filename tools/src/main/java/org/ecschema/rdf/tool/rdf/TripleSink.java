package org.ecschema.rdf.tool.rdf;

import org.ecschema.rdf.common.uri.RDFS;

/**
 * Destination of the exported statements. Writes are appended in call order
 * and never revisited.
 */
public interface TripleSink {
    /**
     * Append a subject predicate object statement. Terms are written as is,
     * literals must already be quoted.
     */
    void writeTriple(String subject, String predicate, String object);

    /**
     * Append a prefix declaration.
     */
    void writePrefix(String prefix, String iri);

    /**
     * Label a resource with its own name.
     */
    default void writeLabel(String rdfName) {
        writeLabel(rdfName, rdfName);
    }

    default void writeLabel(String rdfName, String label) {
        writeTriple(rdfName, RDFS.LABEL, TurtleLiterals.quote(label));
    }

    default void writeComment(String rdfName, String comment) {
        writeTriple(rdfName, RDFS.COMMENT, TurtleLiterals.quote(comment));
    }
}
