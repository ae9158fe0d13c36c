package org.ecschema.rdf.tool.exception;

/**
 * A single value or instance couldn't be exported but the rest of the export
 * should proceed.
 */
public class ContainedException extends RuntimeException {
    public ContainedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainedException(String message) {
        super(message);
    }
}
