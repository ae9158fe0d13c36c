package org.ecschema.rdf.tool.traversal;

import java.util.List;

import org.ecschema.rdf.common.instance.CodeSpec;
import org.ecschema.rdf.common.instance.Element;
import org.ecschema.rdf.common.instance.ElementAspect;
import org.ecschema.rdf.common.instance.Model;
import org.ecschema.rdf.common.instance.Relationship;
import org.ecschema.rdf.common.meta.SchemaRef;
import org.ecschema.rdf.tool.rdf.ExportHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * Replays a {@link RepositoryDocument} through an {@link ExportHandler}:
 * schemas, then code specs, models, elements each followed by its aspects,
 * and relationships. Aspects of elements missing from the document come
 * after the last element.
 */
public class RepositoryTraversal {
    private static final Logger log = LoggerFactory.getLogger(RepositoryTraversal.class);

    private final RepositoryDocument document;

    public RepositoryTraversal(RepositoryDocument document) {
        this.document = document;
    }

    public void traverse(ExportHandler handler) {
        for (SchemaRef schema : document.getSchemas()) {
            handler.onSchema(schema);
        }
        handler.onBeforeInstances();
        for (CodeSpec codeSpec : document.getCodeSpecs()) {
            handler.onCodeSpec(codeSpec);
        }
        for (Model model : document.getModels()) {
            handler.onModel(model);
        }
        ListMultimap<String, ElementAspect> aspects = ArrayListMultimap.create();
        for (ElementAspect aspect : document.getAspects()) {
            aspects.put(aspect.getElementId(), aspect);
        }
        for (Element element : document.getElements()) {
            handler.onElement(element);
            List<ElementAspect> elementAspects = aspects.removeAll(element.getId());
            if (!elementAspects.isEmpty()) {
                handler.onElementAspects(elementAspects);
            }
        }
        for (String elementId : aspects.keySet()) {
            log.debug("Element {} owning aspects isn't in the document", elementId);
            handler.onElementAspects(aspects.get(elementId));
        }
        for (Relationship relationship : document.getRelationships()) {
            handler.onRelationship(relationship);
        }
    }
}
