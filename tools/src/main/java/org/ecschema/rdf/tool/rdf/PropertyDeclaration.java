package org.ecschema.rdf.tool.rdf;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.uri.RDFS;
import org.ecschema.rdf.common.uri.RdfNames;

/**
 * Writes the triples declaring one property: its kind, domain, range, label
 * and comment, in that order.
 */
final class PropertyDeclaration {
    static void write(TripleSink sink, String classRdfName, String propertyName, String propertyKind,
                      @Nullable String range, @Nullable String comment) {
        String propertyRdfName = RdfNames.formatPropertyName(classRdfName, propertyName);
        sink.writeTriple(propertyRdfName, RDFS.SUB_CLASS_OF, propertyKind);
        sink.writeTriple(propertyRdfName, RDFS.DOMAIN, classRdfName);
        if (range != null) {
            sink.writeTriple(propertyRdfName, RDFS.RANGE, range);
        }
        sink.writeLabel(propertyRdfName, RdfNames.formatPropertyLabel(classRdfName, propertyName));
        if (comment != null && !comment.isEmpty()) {
            sink.writeComment(propertyRdfName, comment);
        }
    }

    private PropertyDeclaration() {
        // Utility class.
    }
}
