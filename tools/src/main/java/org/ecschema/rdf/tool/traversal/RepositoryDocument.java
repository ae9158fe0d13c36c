package org.ecschema.rdf.tool.traversal;

import java.util.List;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.instance.CodeSpec;
import org.ecschema.rdf.common.instance.Element;
import org.ecschema.rdf.common.instance.ElementAspect;
import org.ecschema.rdf.common.instance.Model;
import org.ecschema.rdf.common.instance.Relationship;
import org.ecschema.rdf.common.meta.SchemaRef;
import org.ecschema.rdf.common.meta.SchemaRegistry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Content of a repository: its schemas and its instances, each list in the
 * order it is exported.
 */
@Value
@Builder
@Jacksonized
public class RepositoryDocument {
    /**
     * Id rooting the instance namespaces.
     */
    @Nullable
    String repositoryId;
    @Singular
    List<SchemaRef> schemas;
    @Singular
    List<CodeSpec> codeSpecs;
    @Singular
    List<Model> models;
    @Singular
    List<Element> elements;
    @Singular
    List<ElementAspect> aspects;
    @Singular
    List<Relationship> relationships;

    /**
     * Registry of all the schemas of the document.
     *
     * @throws IllegalArgumentException if two schemas share a name or alias
     */
    public SchemaRegistry schemaRegistry() {
        return new SchemaRegistry(schemas);
    }
}
