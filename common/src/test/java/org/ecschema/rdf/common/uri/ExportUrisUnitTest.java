package org.ecschema.rdf.common.uri;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.ecschema.rdf.common.meta.SchemaRef;
import org.junit.Test;

public class ExportUrisUnitTest {
    private final ExportUris uris = ExportUris.defaults();

    @Test
    public void schemaNamespaceIncludesVersion() {
        SchemaRef schema = SchemaRef.builder().name("BisCore").alias("bis").version("01.00.10").build();
        assertThat(uris.schemaNamespace(schema)).isEqualTo("http://www.example.org/schemas/BisCore.01.00.10#");
    }

    @Test
    public void schemaNamespaceWithoutVersion() {
        SchemaRef schema = SchemaRef.builder().name("Widgets").alias("wid").build();
        assertThat(uris.schemaNamespace(schema)).isEqualTo("http://www.example.org/schemas/Widgets#");
    }

    @Test
    public void instancePrefixesInOrder() {
        assertThat(uris.instancePrefixes("1234")).containsExactly(
                entry("codeSpecId", "http://www.example.org/iModel/1234/codeSpec#"),
                entry("aspectId", "http://www.example.org/iModel/1234/aspect#"),
                entry("elementId", "http://www.example.org/iModel/1234/element#"),
                entry("modelId", "http://www.example.org/iModel/1234/model#"),
                entry("relationshipId", "http://www.example.org/iModel/1234/relationship#"));
    }

    @Test
    public void customRoots() {
        ExportUris custom = new ExportUris("http://acme.test/ec#", "http://acme.test/s/", "http://acme.test/r/");
        assertThat(custom.ecNamespace()).isEqualTo("http://acme.test/ec#");
        assertThat(custom.instanceNamespace("x", InstancePrefix.MODEL)).isEqualTo("http://acme.test/r/x/model#");
    }

    @Test
    public void repositoryIdIsRequired() {
        assertThatThrownBy(() -> uris.instancePrefixes("")).isInstanceOf(IllegalArgumentException.class);
    }
}
