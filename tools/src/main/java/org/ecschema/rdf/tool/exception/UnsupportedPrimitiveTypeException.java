package org.ecschema.rdf.tool.exception;

import org.ecschema.rdf.common.meta.PrimitiveType;

/**
 * A primitive property has a type with no range in the upper vocabulary.
 */
public class UnsupportedPrimitiveTypeException extends FatalException {
    public UnsupportedPrimitiveTypeException(String propertyRdfName, PrimitiveType type) {
        super("Unsupported primitive type " + type + " for property " + propertyRdfName);
    }
}
