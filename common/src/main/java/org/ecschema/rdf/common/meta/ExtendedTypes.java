package org.ecschema.rdf.common.meta;

/**
 * Extended type names the exporter recognizes. Matching is case insensitive,
 * any other extended type is ignored.
 */
public final class ExtendedTypes {
    /**
     * Binary property holding a GUID.
     */
    public static final String BE_GUID = "BeGuid";
    /**
     * String property holding a JSON document.
     */
    public static final String JSON = "Json";
    /**
     * Long property holding the id of another element.
     */
    public static final String ID = "Id";

    private ExtendedTypes() {
        // Utility class.
    }
}
