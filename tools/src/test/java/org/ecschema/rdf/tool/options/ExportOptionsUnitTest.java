package org.ecschema.rdf.tool.options;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ecschema.rdf.tool.options.OptionsUtils.handleOptions;

import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.ExportUris;
import org.junit.Test;

public class ExportOptionsUnitTest {
    @Test
    public void defaults() {
        ExportOptions options = handleOptions(ExportOptions.class);
        assertThat(options.from()).isEqualTo("-");
        assertThat(options.to()).isEqualTo("-");
        assertThat(options.repositoryId()).isNull();
        assertThat(options.ecNamespace()).isEqualTo(EC.NAMESPACE);
        assertThat(options.verbose()).isFalse();
    }

    @Test
    public void exportUris() {
        ExportOptions options = handleOptions(ExportOptions.class,
                "--from", "repo.json", "-t", "out.ttl.gz",
                "--repositoryId", "1234",
                "--ecNamespace", "http://acme.test/ec#",
                "--repositoryRoot", "http://acme.test/repo/");
        assertThat(options.from()).isEqualTo("repo.json");
        assertThat(options.to()).isEqualTo("out.ttl.gz");
        assertThat(options.repositoryId()).isEqualTo("1234");

        ExportUris uris = ExportOptions.exportUris(options);
        assertThat(uris.ecNamespace()).isEqualTo("http://acme.test/ec#");
        assertThat(uris.instancePrefixes("1234")).containsEntry("modelId", "http://acme.test/repo/1234/model#");
    }
}
