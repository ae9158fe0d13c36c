package org.ecschema.rdf.tool;

import static org.ecschema.rdf.tool.options.OptionsUtils.handleOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.meta.SchemaRegistry;
import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.tool.exception.FatalException;
import org.ecschema.rdf.tool.options.ExportOptions;
import org.ecschema.rdf.tool.rdf.ExportStatistics;
import org.ecschema.rdf.tool.rdf.TurtleExporter;
import org.ecschema.rdf.tool.rdf.TurtleTripleWriter;
import org.ecschema.rdf.tool.traversal.RepositoryDocument;
import org.ecschema.rdf.tool.traversal.RepositoryDocumentParser;
import org.ecschema.rdf.tool.traversal.RepositoryTraversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * Exports a repository document as a single Turtle file.
 */
public class Export {
    private static final Logger log = LoggerFactory.getLogger(Export.class);

    /**
     * Run an export configured from the command line.
     */
    @SuppressWarnings("IllegalCatch")
    public static void main(String[] args) {
        ExportOptions options = handleOptions(ExportOptions.class, args);
        try {
            RepositoryDocument document;
            try (InputStream from = CliUtils.inputStream(options.from())) {
                document = RepositoryDocumentParser.forFile(options.from()).parse(from);
            }
            Export export = new Export(ExportOptions.exportUris(options), document, options.repositoryId());
            try (Writer to = CliUtils.writer(options.to())) {
                ExportStatistics statistics = export.run(to);
                log.info("Exported {}", statistics);
            }
        } catch (FatalException | IOException | IllegalArgumentException e) {
            log.error("Fatal error exporting {}", options.from(), e);
            System.exit(1);
        }
    }

    private final ExportUris uris;
    private final RepositoryDocument document;
    private final String repositoryId;

    /**
     * @param repositoryId overrides the id of the document when not null
     * @throws IllegalArgumentException if neither the document nor the caller
     *             provide a repository id
     */
    public Export(ExportUris uris, RepositoryDocument document, @Nullable String repositoryId) {
        this.uris = uris;
        this.document = document;
        this.repositoryId = Strings.isNullOrEmpty(repositoryId) ? document.getRepositoryId() : repositoryId;
        if (Strings.isNullOrEmpty(this.repositoryId)) {
            throw new IllegalArgumentException("A repository id is required");
        }
    }

    /**
     * Write the whole repository. The writer is flushed but not closed.
     *
     * @throws FatalException if the export can't complete
     */
    public ExportStatistics run(Writer to) {
        SchemaRegistry registry = document.schemaRegistry();
        TurtleTripleWriter sink = new TurtleTripleWriter(to);
        TurtleExporter exporter = new TurtleExporter(sink, registry, uris, repositoryId);
        exporter.declareVocabulary();
        new RepositoryTraversal(document).traverse(exporter);
        log.debug("Wrote {} lines", sink.lines());
        return exporter.statistics();
    }
}
