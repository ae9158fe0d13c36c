package org.ecschema.rdf.tool.rdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ecschema.rdf.test.Matchers.hasStatement;
import static org.ecschema.rdf.test.StatementHelper.literal;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.test.TurtleParsing;
import org.junit.Test;
import org.openrdf.model.Statement;

public class UpperVocabularyWriterUnitTest {
    private static final String EC_NS = "http://www.example.org/ec#";
    private static final String RDFS_NS = "http://www.w3.org/2000/01/rdf-schema#";
    private static final String XSD_NS = "http://www.w3.org/2001/XMLSchema#";

    private final RecordingTripleSink sink = new RecordingTripleSink();
    private final UpperVocabularyWriter writer = new UpperVocabularyWriter(sink, ExportUris.defaults());

    @Test
    public void contentIsTheSameOnEveryCall() {
        writer.declareVocabulary();
        List<String> first = new ArrayList<>(sink.lines());
        sink.clear();
        writer.declareVocabulary();
        assertThat(sink.lines()).isEqualTo(first);
    }

    @Test
    public void prefixesComeFirst() {
        writer.declareVocabulary();
        assertThat(sink.lines().subList(0, 4)).containsExactly(
                "@prefix rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#> .",
                "@prefix rdfs: <" + RDFS_NS + "> .",
                "@prefix xsd: <" + XSD_NS + "> .",
                "@prefix ec: <" + EC_NS + "> .");
        assertThat(sink.lines().get(4)).isEqualTo("ec:Class rdfs:subClassOf rdfs:Class .");
    }

    @Test
    public void isValidTurtle() {
        writer.declareVocabulary();
        Map<String, String> namespaces = new HashMap<>();
        List<Statement> statements = TurtleParsing.parse(sink.turtle(), namespaces);

        assertThat(namespaces).containsEntry("ec", EC_NS).containsEntry("xsd", XSD_NS);
        assertThat(statements, hasStatement(EC_NS + "EntityClass", RDFS_NS + "subClassOf", EC_NS + "Class"));
        assertThat(statements, hasStatement(EC_NS + "Enumeration", RDFS_NS + "subClassOf", RDFS_NS + "Class"));
        assertThat(statements, hasStatement(EC_NS + "RelationshipClass-Source", RDFS_NS + "range",
                EC_NS + "EntityClass"));
        assertThat(statements, hasStatement(EC_NS + "EntityClass-Id", RDFS_NS + "comment",
                literal("Id of the entity instance")));
        assertThat(statements, hasStatement(EC_NS + "Point3d", RDFS_NS + "subClassOf", EC_NS + "JsonString"));
        assertThat(statements, hasStatement(EC_NS + "GuidString", RDFS_NS + "subClassOf", XSD_NS + "string"));
    }

    @Test
    public void everyTermIsLabeled() {
        writer.declareVocabulary();
        for (String term : EC.TERMS) {
            assertThat(sink.lines()).contains(term + " rdfs:label \"" + term + "\" .");
        }
    }

    @Test
    public void ecNamespaceCanBeChanged() {
        ExportUris uris = new ExportUris("http://acme.test/ec#", ExportUris.DEFAULT_SCHEMA_ROOT,
                ExportUris.DEFAULT_REPOSITORY_ROOT);
        new UpperVocabularyWriter(sink, uris).declareVocabulary();
        assertThat(sink.lines()).contains("@prefix ec: <http://acme.test/ec#> .");
    }

    @Test
    public void instancePrefixes() {
        writer.declareInstancePrefixes("1234");
        assertThat(sink.lines()).containsExactly(
                "@prefix codeSpecId: <http://www.example.org/iModel/1234/codeSpec#> .",
                "@prefix aspectId: <http://www.example.org/iModel/1234/aspect#> .",
                "@prefix elementId: <http://www.example.org/iModel/1234/element#> .",
                "@prefix modelId: <http://www.example.org/iModel/1234/model#> .",
                "@prefix relationshipId: <http://www.example.org/iModel/1234/relationship#> .");
    }
}
