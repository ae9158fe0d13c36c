package org.ecschema.rdf.common.meta;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.Nullable;

import org.ecschema.rdf.common.uri.RdfNames;

import com.google.common.collect.ImmutableList;

/**
 * Every schema known to an export, with its classes indexed by
 * {@link ClassKey}. Inheritance, relationship and enumeration references are
 * resolved here by key rather than through links between the classes
 * themselves.
 */
public class SchemaRegistry {
    private final Map<String, SchemaRef> schemas = new LinkedHashMap<>();
    private final Map<ClassKey, ClassMeta> classes = new LinkedHashMap<>();

    public SchemaRegistry() {
    }

    public SchemaRegistry(Collection<SchemaRef> schemas) {
        schemas.forEach(this::register);
    }

    /**
     * Add a schema and index its classes.
     *
     * @throws IllegalArgumentException if a schema with the same name or alias
     *             is already registered
     */
    public void register(SchemaRef schema) {
        checkArgument(!schemas.containsKey(schema.getName()), "Schema %s is already registered", schema.getName());
        for (SchemaRef other : schemas.values()) {
            checkArgument(!other.getAlias().equals(schema.getAlias()),
                    "Alias %s of schema %s is already used by %s", schema.getAlias(), schema.getName(), other.getName());
        }
        schemas.put(schema.getName(), schema);
        for (ClassMeta c : schema.getClasses()) {
            classes.put(ClassKey.of(schema.getName(), c.getName()), c);
        }
    }

    /**
     * Registered schemas in registration order.
     */
    public Collection<SchemaRef> schemas() {
        return Collections.unmodifiableCollection(schemas.values());
    }

    public Optional<SchemaRef> findSchema(String schemaName) {
        return Optional.ofNullable(schemas.get(schemaName));
    }

    public Optional<ClassMeta> findClass(ClassKey key) {
        return Optional.ofNullable(classes.get(key));
    }

    /**
     * Format the RDF name of a class, e.g. bis:Element.
     *
     * @return the name or empty if the schema of the class isn't registered
     */
    public Optional<String> findRdfName(ClassKey key) {
        return findSchema(key.getSchemaName()).map(s -> RdfNames.formatClassName(s.getAlias(), key.getName()));
    }

    /**
     * Keys of a class and of all of its bases, most derived first. The walk
     * stops at the first class without a base or at the first base that isn't
     * registered.
     *
     * @throws IllegalStateException if the inheritance chain loops
     */
    public List<ClassKey> inheritanceChain(ClassKey key) {
        Set<ClassKey> chain = new LinkedHashSet<>();
        ClassKey current = key;
        while (current != null) {
            if (!chain.add(current)) {
                throw new IllegalStateException("Circular inheritance involving " + current);
            }
            ClassMeta c = classes.get(current);
            current = c == null ? null : c.getBaseClass();
        }
        return ImmutableList.copyOf(chain);
    }

    /**
     * The class at the top of the inheritance chain.
     */
    @Nullable
    public ClassMeta rootClass(ClassKey key) {
        List<ClassKey> chain = new ArrayList<>(inheritanceChain(key));
        Collections.reverse(chain);
        for (ClassKey k : chain) {
            ClassMeta c = classes.get(k);
            if (c != null) {
                return c;
            }
        }
        return null;
    }

    /**
     * Is this a relationship without a link table? Those are only visible
     * through the navigation properties that follow them. The custom
     * attribute is looked up on the root of the relationship's hierarchy.
     */
    public boolean isNavigationRelationship(ClassMeta c) {
        if (c.getKind() != ClassKind.RELATIONSHIP_CLASS) {
            return false;
        }
        ClassMeta root = c;
        if (c.getBaseClass() != null) {
            ClassMeta registeredRoot = rootClass(c.getBaseClass());
            if (registeredRoot != null) {
                root = registeredRoot;
            }
        }
        return !root.hasCustomAttribute(ClassMeta.LINK_TABLE_RELATIONSHIP_MAP);
    }
}
