package org.ecschema.rdf.tool.rdf;

import static org.ecschema.rdf.common.meta.ExtendedTypes.BE_GUID;
import static org.ecschema.rdf.common.meta.ExtendedTypes.ID;
import static org.ecschema.rdf.common.meta.ExtendedTypes.JSON;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.instance.Code;
import org.ecschema.rdf.common.instance.CodeSpec;
import org.ecschema.rdf.common.instance.Element;
import org.ecschema.rdf.common.instance.ElementAspect;
import org.ecschema.rdf.common.instance.Id64;
import org.ecschema.rdf.common.instance.Instance;
import org.ecschema.rdf.common.instance.Model;
import org.ecschema.rdf.common.instance.RelatedElement;
import org.ecschema.rdf.common.instance.Relationship;
import org.ecschema.rdf.common.meta.BisCore;
import org.ecschema.rdf.common.meta.ClassKey;
import org.ecschema.rdf.common.meta.ClassMeta;
import org.ecschema.rdf.common.meta.PrimitiveType;
import org.ecschema.rdf.common.meta.PropertyMeta;
import org.ecschema.rdf.common.meta.SchemaRegistry;
import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.InstancePrefix;
import org.ecschema.rdf.common.uri.RDF;
import org.ecschema.rdf.common.uri.RdfNames;
import org.ecschema.rdf.tool.MapperUtils;
import org.ecschema.rdf.tool.exception.ContainedException;
import org.ecschema.rdf.tool.exception.UnresolvedReferenceException;
import org.ecschema.rdf.tool.exception.UnsupportedPrimitiveTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;

/**
 * Writes instances: a type statement followed by one statement per property
 * value, walking the properties of the instance class and then those of its
 * bases. A missing value is represented by a missing statement.
 */
public class InstanceMapper {
    private static final Logger log = LoggerFactory.getLogger(InstanceMapper.class);

    /**
     * Navigation properties named like this point to models rather than
     * elements.
     */
    private static final String MODEL_SUFFIX = "Model";

    private final TripleSink sink;
    private final SchemaRegistry registry;
    private final ExportStatistics statistics;

    public InstanceMapper(TripleSink sink, SchemaRegistry registry, ExportStatistics statistics) {
        this.sink = sink;
        this.registry = registry;
        this.statistics = statistics;
    }

    /**
     * Write an element, its code if it has one and its property values.
     *
     * @throws UnresolvedReferenceException if the id of the element isn't
     *             valid or its class isn't registered, nothing is written then
     */
    public void writeElement(Element element) {
        String subject = subject(InstancePrefix.ELEMENT, element.getId());
        writeType(subject, element.getClassKey());
        Code code = element.getCode();
        if (code != null && !code.isEmpty()) {
            writeCode(subject, code);
        }
        writeProperties(subject, element);
    }

    private void writeCode(String subject, Code code) {
        String elementRdfName;
        try {
            elementRdfName = classRdfName(BisCore.ELEMENT);
        } catch (UnresolvedReferenceException e) {
            log.debug("Skipping code of {}: {}", subject, e.getMessage());
            statistics.valueSkipped();
            return;
        }
        writeReference(subject, RdfNames.formatPropertyName(elementRdfName, BisCore.CODE_SPEC_PROPERTY),
                InstancePrefix.CODE_SPEC, code.getSpec());
        writeReference(subject, RdfNames.formatPropertyName(elementRdfName, BisCore.CODE_SCOPE_PROPERTY),
                InstancePrefix.ELEMENT, code.getScope());
        sink.writeTriple(subject, RdfNames.formatPropertyName(elementRdfName, BisCore.CODE_VALUE_PROPERTY),
                TurtleLiterals.quote(code.getValue()));
    }

    public void writeModel(Model model) {
        String subject = subject(InstancePrefix.MODEL, model.getId());
        writeType(subject, model.getClassKey());
        writeProperties(subject, model);
    }

    public void writeAspect(ElementAspect aspect) {
        String subject = subject(InstancePrefix.ELEMENT_ASPECT, aspect.getId());
        writeType(subject, aspect.getClassKey());
        writeProperties(subject, aspect);
    }

    public void writeAspects(List<? extends ElementAspect> aspects) {
        for (ElementAspect aspect : aspects) {
            writeAspect(aspect);
        }
    }

    /**
     * Write a link table relationship with its two ends and its property
     * values. An end with an invalid id is skipped on its own.
     */
    public void writeRelationship(Relationship relationship) {
        String subject = subject(InstancePrefix.RELATIONSHIP, relationship.getId());
        writeType(subject, relationship.getClassKey());
        writeReference(subject,
                RdfNames.formatPropertyName(EC.RELATIONSHIP_CLASS, UpperVocabularyWriter.SOURCE_PROPERTY),
                InstancePrefix.ELEMENT, relationship.getSourceId());
        writeReference(subject,
                RdfNames.formatPropertyName(EC.RELATIONSHIP_CLASS, UpperVocabularyWriter.TARGET_PROPERTY),
                InstancePrefix.ELEMENT, relationship.getTargetId());
        writeProperties(subject, relationship);
    }

    /**
     * Write a code specification, typed as BisCore:CodeSpec.
     *
     * @throws UnresolvedReferenceException if the id of the code spec isn't
     *             valid or the core schema isn't registered
     */
    public void writeCodeSpec(CodeSpec codeSpec) {
        String subject = subject(InstancePrefix.CODE_SPEC, codeSpec.getId());
        String classRdfName = classRdfName(BisCore.CODE_SPEC);
        sink.writeTriple(subject, RDF.TYPE, classRdfName);
        if (!isAbsent(codeSpec.getName())) {
            sink.writeTriple(subject, RdfNames.formatPropertyName(classRdfName, BisCore.NAME_PROPERTY),
                    TurtleLiterals.quote(codeSpec.getName()));
        }
    }

    private static String subject(InstancePrefix prefix, @Nullable String id) {
        if (!Id64.isValid(id)) {
            throw new UnresolvedReferenceException("Invalid " + prefix + " id " + id);
        }
        return RdfNames.formatInstanceId(prefix, id);
    }

    /**
     * Write a statement pointing to another instance, skipping it alone when
     * the id isn't valid.
     */
    private void writeReference(String subject, String predicate, InstancePrefix prefix, @Nullable String id) {
        try {
            sink.writeTriple(subject, predicate, RdfNames.formatInstanceId(prefix, validId(predicate, id)));
        } catch (ContainedException e) {
            log.debug("Skipping {} of {}: {}", predicate, subject, e.getMessage());
            statistics.valueSkipped();
        }
    }

    private void writeType(String subject, ClassKey classKey) {
        sink.writeTriple(subject, RDF.TYPE, classRdfName(classKey));
    }

    private String classRdfName(ClassKey classKey) {
        return registry.findRdfName(classKey).orElseThrow(() ->
                new UnresolvedReferenceException("Class " + classKey + " isn't registered"));
    }

    private void writeProperties(String subject, Instance instance) {
        for (ClassKey key : registry.inheritanceChain(instance.getClassKey())) {
            ClassMeta c = registry.findClass(key).orElse(null);
            if (c == null) {
                log.debug("Base class {} of {} isn't registered", key, subject);
                continue;
            }
            String classRdfName = classRdfName(key);
            for (PropertyMeta p : c.getProperties()) {
                Object value = propertyValue(instance, p);
                if (isAbsent(value)) {
                    continue;
                }
                String predicate = RdfNames.formatPropertyName(classRdfName, p.getName());
                try {
                    writePropertyValue(subject, predicate, p, value);
                } catch (ContainedException e) {
                    log.debug("Skipping {} of {}: {}", predicate, subject, e.getMessage());
                    statistics.valueSkipped();
                }
            }
        }
    }

    /**
     * Value of the property, by its name or, failing that, by the same name
     * starting with a lower case letter.
     */
    @Nullable
    private static Object propertyValue(Instance instance, PropertyMeta p) {
        Object value = instance.getPropertyValue(p.getName());
        if (value == null && !p.getName().isEmpty()) {
            String lowerFirst = p.getName().substring(0, 1).toLowerCase(Locale.ROOT) + p.getName().substring(1);
            value = instance.getPropertyValue(lowerFirst);
        }
        return value;
    }

    /**
     * Is this value absent? Null, empty strings, empty collections, maps and
     * arrays are. Zero and false aren't.
     */
    @VisibleForTesting
    static boolean isAbsent(@Nullable Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    @VisibleForTesting
    void writePropertyValue(String subject, String predicate, PropertyMeta p, Object value) {
        if (p.isArray()) {
            log.trace("Not expanding array {} of {}", predicate, subject);
            return;
        }
        switch (p.getKind()) {
            case PRIMITIVE:
            case ENUMERATION:
                writePrimitiveValue(subject, predicate, p, value);
                return;
            case NAVIGATION:
                writeNavigationValue(subject, predicate, p, value);
                return;
            case STRUCT:
                log.trace("Not expanding struct {} of {}", predicate, subject);
                return;
            default:
                throw new IllegalArgumentException("Unknown property kind " + p.getKind());
        }
    }

    private void writePrimitiveValue(String subject, String predicate, PropertyMeta p, Object value) {
        // Enumeration values carry their underlying primitive
        PrimitiveType type = p.getPrimitiveType();
        if (type == null) {
            sink.writeTriple(subject, predicate, raw(value));
            return;
        }
        switch (type) {
            case BINARY:
                if (p.hasExtendedType(BE_GUID)) {
                    sink.writeTriple(subject, predicate, TurtleLiterals.quote(String.valueOf(value)));
                } else {
                    log.trace("Not writing binary {} of {}", predicate, subject);
                }
                return;
            case POINT_2D:
            case POINT_3D:
                sink.writeTriple(subject, predicate, TurtleLiterals.quoteJson(value));
                return;
            case STRING:
                if (p.hasExtendedType(JSON)) {
                    writeJsonValue(subject, predicate, value);
                } else {
                    sink.writeTriple(subject, predicate, TurtleLiterals.quote(String.valueOf(value)));
                }
                return;
            case LONG:
                if (p.hasExtendedType(ID)) {
                    sink.writeTriple(subject, predicate, RdfNames.formatInstanceId(InstancePrefix.ELEMENT,
                            validId(predicate, value)));
                } else {
                    sink.writeTriple(subject, predicate, raw(value));
                }
                return;
            case BOOLEAN:
            case DATE_TIME:
            case DOUBLE:
            case GEOMETRY:
            case INTEGER:
                sink.writeTriple(subject, predicate, raw(value));
                return;
            default:
                throw new UnsupportedPrimitiveTypeException(predicate, type);
        }
    }

    /**
     * Json strings may hold either the JSON text or the parsed structure.
     * Both are written only when the structure isn't empty.
     */
    private void writeJsonValue(String subject, String predicate, Object value) {
        Object structure = value;
        if (value instanceof String) {
            JsonNode node;
            try {
                node = MapperUtils.getObjectMapper().readTree((String) value);
            } catch (IOException e) {
                throw new ContainedException("Invalid JSON in " + predicate, e);
            }
            if (node.isMissingNode() || node.isNull() || node.isContainerNode() && node.size() == 0) {
                log.trace("Empty JSON in {} of {}", predicate, subject);
                return;
            }
            structure = node;
        }
        sink.writeTriple(subject, predicate, TurtleLiterals.quoteJson(structure));
    }

    private void writeNavigationValue(String subject, String predicate, PropertyMeta p, Object value) {
        InstancePrefix prefix = p.getName().endsWith(MODEL_SUFFIX) ? InstancePrefix.MODEL : InstancePrefix.ELEMENT;
        sink.writeTriple(subject, predicate, RdfNames.formatInstanceId(prefix, validId(predicate, value)));
    }

    private static String validId(String predicate, @Nullable Object value) {
        String id = RelatedElement.idFromValue(value);
        if (!Id64.isValid(id)) {
            throw new UnresolvedReferenceException("Invalid id " + id + " in " + predicate);
        }
        return id;
    }

    private static String raw(Object value) {
        return String.valueOf(value);
    }
}
