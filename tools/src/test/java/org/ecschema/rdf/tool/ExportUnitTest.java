package org.ecschema.rdf.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ecschema.rdf.test.Matchers.hasStatement;
import static org.ecschema.rdf.test.StatementHelper.literal;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.test.TurtleParsing;
import org.ecschema.rdf.tool.rdf.ExportStatistics;
import org.ecschema.rdf.tool.traversal.RepositoryDocument;
import org.ecschema.rdf.tool.traversal.RepositoryDocumentParser;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.openrdf.model.Statement;

public class ExportUnitTest {
    private static final String RDF_TYPE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#type";
    private static final String EC_NS = "http://www.example.org/ec#";
    private static final String BIS_NS = "http://www.example.org/schemas/BisCore.01.00.10#";
    private static final String WID_NS = "http://www.example.org/schemas/Widgets.01.00.00#";
    private static final String REPOSITORY = "http://www.example.org/iModel/f0b4e2d6-widgets/";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private RepositoryDocument document() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/repository.json")) {
            return RepositoryDocumentParser.parseJson(is);
        }
    }

    @Test
    public void exportsTheWholeDocument() throws IOException {
        StringWriter out = new StringWriter();
        ExportStatistics statistics = new Export(ExportUris.defaults(), document(), null).run(out);

        List<Statement> statements = TurtleParsing.parse(out.toString());
        assertThat(statements, hasStatement(WID_NS + "Widget", "http://www.w3.org/2000/01/rdf-schema#subClassOf",
                BIS_NS + "Element"));
        assertThat(statements, hasStatement(REPOSITORY + "element#e0x1d", RDF_TYPE, WID_NS + "Widget"));
        assertThat(statements, hasStatement(REPOSITORY + "element#e0x1d", WID_NS + "Widget-Name",
                literal("Acme \"deluxe\"")));
        assertThat(statements, hasStatement(REPOSITORY + "element#e0x1d", BIS_NS + "Element-CodeSpec",
                REPOSITORY + "codeSpec#c0x1"));
        assertThat(statements, hasStatement(REPOSITORY + "element#e0x1d", BIS_NS + "Element-Model",
                REPOSITORY + "model#m0x10"));
        assertThat(statements, hasStatement(REPOSITORY + "aspect#a0x40", WID_NS + "WidgetHasInspection-Inspector",
                literal("Kim")));
        assertThat(statements, hasStatement(REPOSITORY + "relationship#r0x30", EC_NS + "RelationshipClass-Target",
                REPOSITORY + "element#e0x1e"));
        assertThat(statements, hasStatement(REPOSITORY + "codeSpec#c0x1", BIS_NS + "CodeSpec-Name",
                literal("wid:Widget")));

        assertThat(statistics.getSchemas()).isEqualTo(2);
        // the element of an unknown class
        assertThat(statistics.getSkippedInstances()).isEqualTo(1);
        assertThat(statistics.getInstances()).isEqualTo(6);
    }

    @Test
    public void repositoryIdCanBeOverridden() throws IOException {
        StringWriter out = new StringWriter();
        new Export(ExportUris.defaults(), document(), "other").run(out);
        assertThat(out.toString()).contains("@prefix elementId: <http://www.example.org/iModel/other/element#> .");
    }

    @Test
    public void repositoryIdIsRequired() {
        RepositoryDocument document = RepositoryDocument.builder().build();
        assertThatThrownBy(() -> new Export(ExportUris.defaults(), document, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void writesToFile() throws IOException {
        File output = new File(temporaryFolder.getRoot(), "out/export.ttl");
        try (Writer to = CliUtils.writer(output.getPath())) {
            new Export(ExportUris.defaults(), document(), null).run(to);
        }

        String turtle = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
        assertThat(turtle).startsWith("@prefix rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#> .\n");
        assertThat(TurtleParsing.parse(turtle)).isNotEmpty();
    }

    @Test
    public void existingFilesAreTruncated() throws IOException {
        File output = temporaryFolder.newFile("export.ttl");
        Files.write(output.toPath(), "this is not turtle and it is quite long".getBytes(StandardCharsets.UTF_8));
        try (Writer to = CliUtils.writer(output.getPath())) {
            to.write("a");
        }
        assertThat(new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8)).isEqualTo("a");
    }
}
