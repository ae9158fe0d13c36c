package org.ecschema.rdf.common.meta;

/**
 * Classes of the core schema the exporter refers to by name.
 */
public final class BisCore {
    public static final String SCHEMA_NAME = "BisCore";
    /**
     * Root of all elements, declares the code properties.
     */
    public static final ClassKey ELEMENT = ClassKey.of(SCHEMA_NAME, "Element");
    /**
     * Class code specifications are typed as.
     */
    public static final ClassKey CODE_SPEC = ClassKey.of(SCHEMA_NAME, "CodeSpec");

    public static final String CODE_SPEC_PROPERTY = "CodeSpec";
    public static final String CODE_SCOPE_PROPERTY = "CodeScope";
    public static final String CODE_VALUE_PROPERTY = "CodeValue";
    public static final String NAME_PROPERTY = "Name";

    private BisCore() {
        // Utility class.
    }
}
