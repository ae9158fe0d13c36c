package org.ecschema.rdf.tool.exception;

/**
 * A class, relationship or instance id referenced by the data can't be
 * resolved. Only the triple needing it is skipped.
 */
public class UnresolvedReferenceException extends ContainedException {
    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
