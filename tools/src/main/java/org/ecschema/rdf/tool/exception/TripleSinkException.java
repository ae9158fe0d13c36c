package org.ecschema.rdf.tool.exception;

/**
 * The Turtle output can't be written to. Output isn't transactional so
 * nothing is retried.
 */
public class TripleSinkException extends FatalException {
    public TripleSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
