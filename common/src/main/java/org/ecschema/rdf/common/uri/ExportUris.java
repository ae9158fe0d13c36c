package org.ecschema.rdf.common.uri;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;

import javax.annotation.concurrent.Immutable;

import org.ecschema.rdf.common.meta.SchemaRef;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Iris the prefixes of an export are bound to. The upper vocabulary iri and
 * the roots for schemas and instances can be replaced, everything else is
 * fixed.
 */
@Immutable
public class ExportUris {
    /**
     * Default root of schema namespaces.
     */
    public static final String DEFAULT_SCHEMA_ROOT = "http://www.example.org/schemas/";
    /**
     * Default root of instance namespaces, the repository id is appended to it.
     */
    public static final String DEFAULT_REPOSITORY_ROOT = "http://www.example.org/iModel/";

    private final String ecNamespace;
    private final String schemaRoot;
    private final String repositoryRoot;

    public ExportUris(String ecNamespace, String schemaRoot, String repositoryRoot) {
        checkArgument(!Strings.isNullOrEmpty(ecNamespace), "Upper vocabulary namespace is required");
        checkArgument(!Strings.isNullOrEmpty(schemaRoot), "Schema root is required");
        checkArgument(!Strings.isNullOrEmpty(repositoryRoot), "Repository root is required");
        this.ecNamespace = ecNamespace;
        this.schemaRoot = schemaRoot;
        this.repositoryRoot = repositoryRoot;
    }

    /**
     * Uris of a repository using the default roots.
     */
    public static ExportUris defaults() {
        return new ExportUris(EC.NAMESPACE, DEFAULT_SCHEMA_ROOT, DEFAULT_REPOSITORY_ROOT);
    }

    /**
     * Namespace of the upper vocabulary, bound to {@link EC#PREFIX}.
     */
    public String ecNamespace() {
        return ecNamespace;
    }

    /**
     * Namespace of a schema, e.g.
     * http://www.example.org/schemas/BisCore.01.00.10#.
     */
    public String schemaNamespace(SchemaRef schema) {
        return schemaRoot + schema.getSchemaKey() + "#";
    }

    /**
     * Namespace of one kind of instance of a repository, e.g.
     * http://www.example.org/iModel/1234/element#.
     */
    public String instanceNamespace(String repositoryId, InstancePrefix prefix) {
        checkArgument(!Strings.isNullOrEmpty(repositoryId), "Repository id is required");
        return repositoryRoot + repositoryId + "/" + prefix.suffix();
    }

    /**
     * Prefix to namespace map for all instance kinds of a repository, in
     * declaration order.
     */
    public Map<String, String> instancePrefixes(String repositoryId) {
        ImmutableMap.Builder<String, String> prefixes = ImmutableMap.builder();
        for (InstancePrefix prefix : InstancePrefix.values()) {
            prefixes.put(prefix.prefix(), instanceNamespace(repositoryId, prefix));
        }
        return prefixes.build();
    }
}
