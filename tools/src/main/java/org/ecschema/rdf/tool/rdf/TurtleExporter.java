package org.ecschema.rdf.tool.rdf;

import java.util.List;

import org.ecschema.rdf.common.instance.CodeSpec;
import org.ecschema.rdf.common.instance.Element;
import org.ecschema.rdf.common.instance.ElementAspect;
import org.ecschema.rdf.common.instance.Instance;
import org.ecschema.rdf.common.instance.Model;
import org.ecschema.rdf.common.instance.Relationship;
import org.ecschema.rdf.common.meta.SchemaRef;
import org.ecschema.rdf.common.meta.SchemaRegistry;
import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.tool.exception.ContainedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports a repository as Turtle. Instances that can't be written are logged
 * and skipped, anything fatal propagates to the caller.
 */
public class TurtleExporter implements ExportHandler {
    private static final Logger log = LoggerFactory.getLogger(TurtleExporter.class);

    private final String repositoryId;
    private final UpperVocabularyWriter vocabulary;
    private final SchemaMapper schemaMapper;
    private final InstanceMapper instanceMapper;
    private final ExportStatistics statistics = new ExportStatistics();

    public TurtleExporter(TripleSink sink, SchemaRegistry registry, ExportUris uris, String repositoryId) {
        this.repositoryId = repositoryId;
        vocabulary = new UpperVocabularyWriter(sink, uris);
        schemaMapper = new SchemaMapper(sink, registry, uris);
        instanceMapper = new InstanceMapper(sink, registry, statistics);
    }

    /**
     * Write the upper vocabulary. Must be called once, before anything else.
     */
    public void declareVocabulary() {
        vocabulary.declareVocabulary();
    }

    @Override
    public void onSchema(SchemaRef schema) {
        schemaMapper.writeSchema(schema);
        statistics.schemaWritten();
    }

    @Override
    public void onBeforeInstances() {
        vocabulary.declareInstancePrefixes(repositoryId);
    }

    @Override
    public void onCodeSpec(CodeSpec codeSpec) {
        try {
            instanceMapper.writeCodeSpec(codeSpec);
            statistics.instanceWritten();
        } catch (ContainedException e) {
            log.warn("Skipping code spec {}: {}", codeSpec.getId(), e.getMessage());
            statistics.instanceSkipped();
        }
    }

    @Override
    public void onModel(Model model) {
        try {
            instanceMapper.writeModel(model);
            statistics.instanceWritten();
        } catch (ContainedException e) {
            skipped(model, e);
        }
    }

    @Override
    public void onElement(Element element) {
        try {
            instanceMapper.writeElement(element);
            statistics.instanceWritten();
        } catch (ContainedException e) {
            skipped(element, e);
        }
    }

    @Override
    public void onElementAspects(List<ElementAspect> aspects) {
        for (ElementAspect aspect : aspects) {
            try {
                instanceMapper.writeAspect(aspect);
                statistics.instanceWritten();
            } catch (ContainedException e) {
                skipped(aspect, e);
            }
        }
    }

    @Override
    public void onRelationship(Relationship relationship) {
        try {
            instanceMapper.writeRelationship(relationship);
            statistics.instanceWritten();
        } catch (ContainedException e) {
            skipped(relationship, e);
        }
    }

    private void skipped(Instance instance, ContainedException e) {
        log.warn("Skipping {} {}: {}", instance.getClassFullName(), instance.getId(), e.getMessage());
        statistics.instanceSkipped();
    }

    public ExportStatistics statistics() {
        return statistics;
    }
}
