package org.ecschema.rdf.tool.options;

import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.ExportUris;

import com.lexicalscope.jewel.cli.Option;

/**
 * CLI options for use with Export.
 */
@SuppressWarnings("checkstyle:javadocmethod")
public interface ExportOptions extends OptionsUtils.BasicOptions {
    @Option(shortName = "f", defaultValue = "-",
            description = "Repository document to export, YAML if it ends in .yaml or .yml and JSON otherwise. "
                    + "Gzipped if it ends in .gz. Defaults to - aka stdin, read as JSON.")
    String from();

    @Option(shortName = "t", defaultValue = "-",
            description = "Turtle file to write, gzipped if it ends in .gz. Defaults to - aka stdout.")
    String to();

    @Option(defaultToNull = true, description = "Repository id rooting the instance namespaces. "
            + "Defaults to the one from the document.")
    String repositoryId();

    @Option(defaultValue = EC.NAMESPACE, description = "Namespace of the ec upper vocabulary")
    String ecNamespace();

    @Option(defaultValue = ExportUris.DEFAULT_SCHEMA_ROOT, description = "Root of the schema namespaces")
    String schemaRoot();

    @Option(defaultValue = ExportUris.DEFAULT_REPOSITORY_ROOT, description = "Root of the instance namespaces")
    String repositoryRoot();

    static ExportUris exportUris(ExportOptions options) {
        return new ExportUris(options.ecNamespace(), options.schemaRoot(), options.repositoryRoot());
    }
}
