package org.ecschema.rdf.tool.rdf;

import static org.ecschema.rdf.common.meta.ExtendedTypes.BE_GUID;
import static org.ecschema.rdf.common.meta.ExtendedTypes.JSON;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.meta.ClassKey;
import org.ecschema.rdf.common.meta.ClassMeta;
import org.ecschema.rdf.common.meta.PrimitiveType;
import org.ecschema.rdf.common.meta.PropertyKind;
import org.ecschema.rdf.common.meta.PropertyMeta;
import org.ecschema.rdf.common.meta.RelationshipConstraint;
import org.ecschema.rdf.common.meta.SchemaRef;
import org.ecschema.rdf.common.meta.SchemaRegistry;
import org.ecschema.rdf.common.meta.StrengthDirection;
import org.ecschema.rdf.common.uri.EC;
import org.ecschema.rdf.common.uri.ExportUris;
import org.ecschema.rdf.common.uri.RDF;
import org.ecschema.rdf.common.uri.RDFS;
import org.ecschema.rdf.common.uri.RdfNames;
import org.ecschema.rdf.common.uri.XSD;
import org.ecschema.rdf.tool.exception.FatalException;
import org.ecschema.rdf.tool.exception.UnresolvedReferenceException;
import org.ecschema.rdf.tool.exception.UnsupportedClassKindException;
import org.ecschema.rdf.tool.exception.UnsupportedPrimitiveTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

/**
 * Maps schemas to RDFS: every class becomes a subclass of its base or of the
 * upper vocabulary term for its kind, every declared property a typed
 * property with the class as domain.
 */
public class SchemaMapper {
    private static final Logger log = LoggerFactory.getLogger(SchemaMapper.class);

    private final TripleSink sink;
    private final SchemaRegistry registry;
    private final ExportUris uris;
    /**
     * RDF names of the classes declared so far.
     */
    private final Set<String> declared = new HashSet<>();

    public SchemaMapper(TripleSink sink, SchemaRegistry registry, ExportUris uris) {
        this.sink = sink;
        this.registry = registry;
        this.uris = uris;
    }

    /**
     * Declare the schema prefix then map its classes in declaration order.
     */
    public void writeSchema(SchemaRef schema) {
        log.debug("Mapping schema {} with {} classes", schema.getSchemaKey(), schema.getClasses().size());
        sink.writePrefix(schema.getAlias(), uris.schemaNamespace(schema));
        for (ClassMeta c : schema.getClasses()) {
            writeClass(schema, c);
        }
    }

    /**
     * Map a single class and its declared properties. Navigation
     * relationships and classes already mapped are skipped.
     *
     * @throws UnsupportedClassKindException if the class has no base and no
     *             upper vocabulary term for its kind
     * @throws UnsupportedPrimitiveTypeException if one of its primitive
     *             properties has a type without a range
     */
    public void writeClass(SchemaRef schema, ClassMeta c) {
        if (registry.isNavigationRelationship(c)) {
            log.trace("Skipping navigation relationship {}:{}", schema.getName(), c.getName());
            return;
        }
        String classRdfName = RdfNames.formatClassName(schema.getAlias(), c.getName());
        if (!declared.add(classRdfName)) {
            log.debug("{} is already declared", classRdfName);
            return;
        }
        sink.writeTriple(classRdfName, RDFS.SUB_CLASS_OF, parentClass(classRdfName, c));
        sink.writeLabel(classRdfName, Strings.isNullOrEmpty(c.getLabel()) ? classRdfName : c.getLabel());
        if (c.getDescription() != null && !c.getDescription().isEmpty()) {
            sink.writeComment(classRdfName, c.getDescription());
        }
        for (PropertyMeta p : c.getProperties()) {
            writeProperty(classRdfName, p);
        }
    }

    private String parentClass(String classRdfName, ClassMeta c) {
        ClassKey base = c.getBaseClass();
        if (base != null) {
            return registry.findRdfName(base).orElseThrow(() ->
                    new FatalException("Base class " + base + " of " + classRdfName + " isn't registered"));
        }
        switch (c.getKind()) {
            case CUSTOM_ATTRIBUTE_CLASS:
                return EC.CUSTOM_ATTRIBUTE_CLASS;
            case ENTITY_CLASS:
                return EC.ENTITY_CLASS;
            case ENUMERATION:
                return EC.ENUMERATION;
            case MIXIN:
                return EC.MIXIN;
            case RELATIONSHIP_CLASS:
                return EC.RELATIONSHIP_CLASS;
            default:
                throw new UnsupportedClassKindException(classRdfName, c.getKind());
        }
    }

    @VisibleForTesting
    void writeProperty(String classRdfName, PropertyMeta p) {
        if (p.isArray()) {
            String kind = p.getKind() == PropertyKind.STRUCT ? EC.STRUCT_ARRAY_PROPERTY : EC.PRIMITIVE_ARRAY_PROPERTY;
            declare(classRdfName, p, kind, RDF.LIST);
            return;
        }
        switch (p.getKind()) {
            case ENUMERATION:
                Optional<String> enumeration = p.getEnumeration() == null
                        ? Optional.empty() : registry.findRdfName(p.getEnumeration());
                if (enumeration.isPresent()) {
                    declare(classRdfName, p, EC.PRIMITIVE_PROPERTY, enumeration.get());
                } else if (p.getPrimitiveType() != null) {
                    log.debug("Enumeration {} of {}-{} isn't registered, using its primitive type",
                            p.getEnumeration(), classRdfName, p.getName());
                    declare(classRdfName, p, EC.PRIMITIVE_PROPERTY, primitiveRange(classRdfName, p));
                } else {
                    log.warn("Enumeration property {}-{} has neither a registered enumeration nor a primitive type",
                            classRdfName, p.getName());
                }
                return;
            case NAVIGATION:
                declare(classRdfName, p, EC.NAVIGATION_PROPERTY, navigationRange(classRdfName, p));
                return;
            case STRUCT:
                declare(classRdfName, p, EC.STRUCT_PROPERTY, null);
                return;
            case PRIMITIVE:
                declare(classRdfName, p, EC.PRIMITIVE_PROPERTY, primitiveRange(classRdfName, p));
                return;
            default:
                throw new IllegalArgumentException("Unknown property kind " + p.getKind());
        }
    }

    private void declare(String classRdfName, PropertyMeta p, String kind, @Nullable String range) {
        PropertyDeclaration.write(sink, classRdfName, p.getName(), kind, range, p.getDescription());
    }

    /**
     * Range of a scalar primitive property.
     *
     * @throws UnsupportedPrimitiveTypeException if the type has no range
     */
    @VisibleForTesting
    static String primitiveRange(String classRdfName, PropertyMeta p) {
        PrimitiveType type = p.getPrimitiveType() == null ? PrimitiveType.UNINITIALIZED : p.getPrimitiveType();
        switch (type) {
            case BINARY:
                return p.hasExtendedType(BE_GUID) ? EC.GUID_STRING : XSD.BASE64_BINARY;
            case BOOLEAN:
                return XSD.BOOLEAN;
            case DATE_TIME:
                return XSD.DATE_TIME;
            case DOUBLE:
                return XSD.DOUBLE;
            case GEOMETRY:
                return EC.IGEOMETRY;
            case INTEGER:
                return XSD.INTEGER;
            case LONG:
                return XSD.LONG;
            case POINT_2D:
                return EC.POINT_2D;
            case POINT_3D:
                return EC.POINT_3D;
            case STRING:
                return p.hasExtendedType(JSON) ? EC.JSON_STRING : XSD.STRING;
            default:
                throw new UnsupportedPrimitiveTypeException(RdfNames.formatPropertyName(classRdfName, p.getName()), type);
        }
    }

    /**
     * Range of a navigation property: the first class of the constraint at
     * the far end of its relationship. Falls back to ec:EntityClass.
     */
    private String navigationRange(String classRdfName, PropertyMeta p) {
        try {
            return resolveNavigationRange(p);
        } catch (UnresolvedReferenceException e) {
            log.warn("Range of {}-{} defaults to {}: {}", classRdfName, p.getName(), EC.ENTITY_CLASS, e.getMessage());
            return EC.ENTITY_CLASS;
        }
    }

    private String resolveNavigationRange(PropertyMeta p) {
        ClassKey relationshipKey = p.getRelationshipClass();
        if (relationshipKey == null) {
            throw new UnresolvedReferenceException("no relationship class");
        }
        ClassMeta relationship = registry.findClass(relationshipKey).orElseThrow(() ->
                new UnresolvedReferenceException("relationship " + relationshipKey + " isn't registered"));
        RelationshipConstraint constraint = p.getDirection() == StrengthDirection.BACKWARD
                ? relationship.getSource() : relationship.getTarget();
        ClassKey end = constraint == null ? null : constraint.defaultClass();
        if (end == null) {
            return EC.ENTITY_CLASS;
        }
        return registry.findRdfName(end).orElseThrow(() ->
                new UnresolvedReferenceException("constraint class " + end + " isn't registered"));
    }
}
