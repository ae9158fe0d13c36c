package org.ecschema.rdf.tool.traversal;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;

/**
 * Reads {@link RepositoryDocument}s from JSON or YAML. Unknown properties are
 * ignored.
 */
public class RepositoryDocumentParser {
    private final ObjectMapper objectMapper;

    public static RepositoryDocument parseJson(InputStream is) throws IOException {
        return jsonParser().parse(is);
    }

    public static RepositoryDocument parseYaml(InputStream is) throws IOException {
        return yamlParser().parse(is);
    }

    public static RepositoryDocumentParser jsonParser() {
        return new RepositoryDocumentParser(new JsonFactory());
    }

    public static RepositoryDocumentParser yamlParser() {
        return new RepositoryDocumentParser(new YAMLFactory());
    }

    /**
     * Parser for a file, YAML if its name ends in .yaml or .yml (optionally
     * followed by .gz), JSON otherwise.
     */
    public static RepositoryDocumentParser forFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gz")) {
            lower = lower.substring(0, lower.length() - ".gz".length());
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return yamlParser();
        }
        return jsonParser();
    }

    public RepositoryDocumentParser(JsonFactory factory) {
        this.objectMapper = JsonMapper.builder(factory)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    @VisibleForTesting
    boolean isYaml() {
        return objectMapper.getFactory() instanceof YAMLFactory;
    }

    public RepositoryDocument parse(InputStream is) throws IOException {
        return objectMapper.readerFor(RepositoryDocument.class).readValue(is);
    }
}
