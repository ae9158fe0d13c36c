package org.ecschema.rdf.tool.rdf;

import java.util.Map;

import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.common.uri.RDF;
import org.ecschema.rdf.common.uri.RDFS;
import org.ecschema.rdf.common.uri.XSD;

/**
 * Declares the fixed upper vocabulary and the instance prefixes. The content
 * is the same on every call, calling twice just writes it twice.
 */
public class UpperVocabularyWriter {
    /**
     * Name of the id property every entity and relationship carries.
     */
    public static final String ID_PROPERTY = "Id";
    /**
     * Source end of a link table relationship instance.
     */
    public static final String SOURCE_PROPERTY = "Source";
    /**
     * Target end of a link table relationship instance.
     */
    public static final String TARGET_PROPERTY = "Target";

    private final TripleSink sink;
    private final ExportUris uris;

    public UpperVocabularyWriter(TripleSink sink, ExportUris uris) {
        this.sink = sink;
        this.uris = uris;
    }

    /**
     * Write the rdf, rdfs, xsd and ec prefixes followed by the upper
     * vocabulary hierarchy and the labels of its terms.
     */
    public void declareVocabulary() {
        sink.writePrefix(RDF.PREFIX, RDF.NAMESPACE);
        sink.writePrefix(RDFS.PREFIX, RDFS.NAMESPACE);
        sink.writePrefix(XSD.PREFIX, XSD.NAMESPACE);
        sink.writePrefix(EC.PREFIX, uris.ecNamespace());

        // classes
        sink.writeTriple(EC.CLASS, RDFS.SUB_CLASS_OF, RDFS.CLASS);
        sink.writeTriple(EC.ENTITY_CLASS, RDFS.SUB_CLASS_OF, EC.CLASS);
        sink.writeTriple(EC.RELATIONSHIP_CLASS, RDFS.SUB_CLASS_OF, EC.CLASS);
        sink.writeTriple(EC.CUSTOM_ATTRIBUTE_CLASS, RDFS.SUB_CLASS_OF, EC.CLASS);
        sink.writeTriple(EC.MIXIN, RDFS.SUB_CLASS_OF, EC.CLASS);
        sink.writeTriple(EC.ENUMERATION, RDFS.SUB_CLASS_OF, RDFS.CLASS);

        // properties every instance has
        PropertyDeclaration.write(sink, EC.ENTITY_CLASS, ID_PROPERTY, EC.PRIMITIVE_PROPERTY, EC.ID64_STRING,
                "Id of the entity instance");
        PropertyDeclaration.write(sink, EC.RELATIONSHIP_CLASS, ID_PROPERTY, EC.PRIMITIVE_PROPERTY, EC.ID64_STRING,
                "Id of the relationship instance");
        PropertyDeclaration.write(sink, EC.RELATIONSHIP_CLASS, SOURCE_PROPERTY, EC.NAVIGATION_PROPERTY, EC.ENTITY_CLASS,
                "The source of the relationship");
        PropertyDeclaration.write(sink, EC.RELATIONSHIP_CLASS, TARGET_PROPERTY, EC.NAVIGATION_PROPERTY, EC.ENTITY_CLASS,
                "The target of the relationship");

        // property kinds
        sink.writeTriple(EC.PROPERTY, RDFS.SUB_CLASS_OF, RDF.PROPERTY);
        sink.writeTriple(EC.PRIMITIVE_PROPERTY, RDFS.SUB_CLASS_OF, EC.PROPERTY);
        sink.writeTriple(EC.PRIMITIVE_ARRAY_PROPERTY, RDFS.SUB_CLASS_OF, EC.PROPERTY);
        sink.writeTriple(EC.STRUCT_PROPERTY, RDFS.SUB_CLASS_OF, EC.PROPERTY);
        sink.writeTriple(EC.STRUCT_ARRAY_PROPERTY, RDFS.SUB_CLASS_OF, EC.PROPERTY);
        sink.writeTriple(EC.NAVIGATION_PROPERTY, RDFS.SUB_CLASS_OF, EC.PROPERTY);

        // primitive types
        sink.writeTriple(EC.GUID_STRING, RDFS.SUB_CLASS_OF, XSD.STRING);
        sink.writeTriple(EC.ID64_STRING, RDFS.SUB_CLASS_OF, XSD.STRING);
        sink.writeTriple(EC.JSON_STRING, RDFS.SUB_CLASS_OF, XSD.STRING);
        sink.writeTriple(EC.POINT_2D, RDFS.SUB_CLASS_OF, EC.JSON_STRING);
        sink.writeTriple(EC.POINT_3D, RDFS.SUB_CLASS_OF, EC.JSON_STRING);

        for (String term : EC.TERMS) {
            sink.writeLabel(term);
        }
    }

    /**
     * Write one prefix per instance kind, rooted at the repository. Must
     * happen before the first instance is written.
     */
    public void declareInstancePrefixes(String repositoryId) {
        for (Map.Entry<String, String> prefix : uris.instancePrefixes(repositoryId).entrySet()) {
            sink.writePrefix(prefix.getKey(), prefix.getValue());
        }
    }
}
