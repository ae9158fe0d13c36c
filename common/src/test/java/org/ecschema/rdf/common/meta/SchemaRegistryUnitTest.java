package org.ecschema.rdf.common.meta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class SchemaRegistryUnitTest {
    private static final ClassKey ROOT = ClassKey.of("Core", "Root");
    private static final ClassKey MIDDLE = ClassKey.of("Core", "Middle");
    private static final ClassKey LEAF = ClassKey.of("Leaves", "Leaf");

    private SchemaRegistry registry() {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register(SchemaRef.builder().name("Core").alias("core")
                .classMeta(ClassMeta.builder().name("Root").kind(ClassKind.ENTITY_CLASS).build())
                .classMeta(ClassMeta.builder().name("Middle").kind(ClassKind.ENTITY_CLASS).baseClass(ROOT).build())
                .classMeta(ClassMeta.builder().name("Links").kind(ClassKind.RELATIONSHIP_CLASS)
                        .customAttribute(ClassMeta.LINK_TABLE_RELATIONSHIP_MAP).build())
                .classMeta(ClassMeta.builder().name("Navigates").kind(ClassKind.RELATIONSHIP_CLASS).build())
                .build());
        registry.register(SchemaRef.builder().name("Leaves").alias("lf")
                .classMeta(ClassMeta.builder().name("Leaf").kind(ClassKind.ENTITY_CLASS).baseClass(MIDDLE).build())
                .classMeta(ClassMeta.builder().name("Orphan").kind(ClassKind.ENTITY_CLASS)
                        .baseClass(ClassKey.of("Missing", "Base")).build())
                .classMeta(ClassMeta.builder().name("SubLinks").kind(ClassKind.RELATIONSHIP_CLASS)
                        .baseClass(ClassKey.of("Core", "Links")).build())
                .build());
        return registry;
    }

    @Test
    public void inheritanceChainMostDerivedFirst() {
        assertThat(registry().inheritanceChain(LEAF)).containsExactly(LEAF, MIDDLE, ROOT);
    }

    @Test
    public void inheritanceChainStopsAtUnregisteredBase() {
        assertThat(registry().inheritanceChain(ClassKey.of("Leaves", "Orphan")))
                .containsExactly(ClassKey.of("Leaves", "Orphan"), ClassKey.of("Missing", "Base"));
    }

    @Test
    public void circularInheritanceFails() {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register(SchemaRef.builder().name("Loop").alias("loop")
                .classMeta(ClassMeta.builder().name("A").kind(ClassKind.ENTITY_CLASS)
                        .baseClass(ClassKey.of("Loop", "B")).build())
                .classMeta(ClassMeta.builder().name("B").kind(ClassKind.ENTITY_CLASS)
                        .baseClass(ClassKey.of("Loop", "A")).build())
                .build());
        assertThatThrownBy(() -> registry.inheritanceChain(ClassKey.of("Loop", "A")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void rdfNamesUseTheAlias() {
        assertThat(registry().findRdfName(LEAF)).contains("lf:Leaf");
        assertThat(registry().findRdfName(ClassKey.of("Missing", "Base"))).isEmpty();
    }

    @Test
    public void rootClass() {
        assertThat(registry().rootClass(LEAF).getName()).isEqualTo("Root");
    }

    @Test
    public void navigationRelationships() {
        SchemaRegistry registry = registry();
        assertThat(registry.isNavigationRelationship(registry.findClass(ClassKey.of("Core", "Navigates")).get()))
                .isTrue();
        assertThat(registry.isNavigationRelationship(registry.findClass(ClassKey.of("Core", "Links")).get()))
                .isFalse();
        // the marker is inherited from the root
        assertThat(registry.isNavigationRelationship(registry.findClass(ClassKey.of("Leaves", "SubLinks")).get()))
                .isFalse();
        assertThat(registry.isNavigationRelationship(registry.findClass(ROOT).get())).isFalse();
    }

    @Test
    public void duplicateSchemaNameOrAliasIsRejected() {
        SchemaRegistry registry = registry();
        assertThatThrownBy(() -> registry.register(SchemaRef.builder().name("Core").alias("other").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(SchemaRef.builder().name("Other").alias("core").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
