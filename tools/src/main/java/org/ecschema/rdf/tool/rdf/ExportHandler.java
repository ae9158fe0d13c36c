package org.ecschema.rdf.tool.rdf;

import java.util.List;

import org.ecschema.rdf.common.instance.CodeSpec;
import org.ecschema.rdf.common.instance.Element;
import org.ecschema.rdf.common.instance.ElementAspect;
import org.ecschema.rdf.common.instance.Model;
import org.ecschema.rdf.common.instance.Relationship;
import org.ecschema.rdf.common.meta.SchemaRef;

/**
 * Receives the content of a repository in traversal order: every schema
 * exactly once, then {@link #onBeforeInstances()}, then the instances.
 */
public interface ExportHandler {
    void onSchema(SchemaRef schema);

    /**
     * Called once, after the last schema and before the first instance.
     */
    void onBeforeInstances();

    void onCodeSpec(CodeSpec codeSpec);

    void onModel(Model model);

    void onElement(Element element);

    /**
     * The aspects of a single element.
     */
    void onElementAspects(List<ElementAspect> aspects);

    void onRelationship(Relationship relationship);
}
