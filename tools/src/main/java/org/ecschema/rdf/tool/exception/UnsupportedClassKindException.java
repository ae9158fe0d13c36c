package org.ecschema.rdf.tool.exception;

import org.ecschema.rdf.common.meta.ClassKind;

/**
 * A class without a base has a kind the upper vocabulary has no parent for.
 */
public class UnsupportedClassKindException extends FatalException {
    public UnsupportedClassKindException(String classRdfName, ClassKind kind) {
        super("Unsupported kind " + kind + " for class " + classRdfName);
    }
}
