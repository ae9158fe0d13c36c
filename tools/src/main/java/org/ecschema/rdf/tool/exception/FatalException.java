package org.ecschema.rdf.tool.exception;

/**
 * The export failed and its output can't be trusted, the run should be
 * stopped.
 */
public class FatalException extends RuntimeException {
    public FatalException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalException(String message) {
        super(message);
    }
}
