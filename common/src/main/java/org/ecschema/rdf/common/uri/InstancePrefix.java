package org.ecschema.rdf.common.uri;

/**
 * Prefixes used to name exported instances. Relationship and model ids are
 * drawn from the same id space as element ids so each kind carries a one
 * letter tag that keeps the names apart once they are mapped to generic
 * resources.
 */
public enum InstancePrefix {
    /**
     * Code specification (codeSpecId:c0x1).
     */
    CODE_SPEC("codeSpecId", 'c', "codeSpec#"),
    /**
     * Unique or multi aspect of an element (aspectId:a0x1).
     */
    ELEMENT_ASPECT("aspectId", 'a', "aspect#"),
    /**
     * Element (elementId:e0x1).
     */
    ELEMENT("elementId", 'e', "element#"),
    /**
     * Model (modelId:m0x1).
     */
    MODEL("modelId", 'm', "model#"),
    /**
     * Link table relationship (relationshipId:r0x1).
     */
    RELATIONSHIP("relationshipId", 'r', "relationship#");

    /**
     * Turtle prefix for the kind.
     */
    private final String prefix;
    /**
     * Letter prepended to the id.
     */
    private final char tag;
    /**
     * Iri suffix after the repository root for the kind.
     */
    private final String suffix;

    InstancePrefix(String prefix, char tag, String suffix) {
        this.prefix = prefix;
        this.tag = tag;
        this.suffix = suffix;
    }

    /**
     * Get prefix.
     *
     * @return prefix
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Get the tag letter.
     */
    public char tag() {
        return tag;
    }

    /**
     * Get suffix. Outside classes should go through
     * {@link ExportUris#instanceNamespace(String, InstancePrefix)}.
     */
    String suffix() {
        return suffix;
    }
}
