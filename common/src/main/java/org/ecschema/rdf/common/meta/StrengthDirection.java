package org.ecschema.rdf.common.meta;

/**
 * Direction a navigation property follows its relationship in.
 */
public enum StrengthDirection {
    /**
     * From source to target, the property points at a target constraint class.
     */
    FORWARD,
    /**
     * From target to source, the property points at a source constraint class.
     */
    BACKWARD
}
