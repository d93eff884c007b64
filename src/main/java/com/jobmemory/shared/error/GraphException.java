package com.jobmemory.shared.error;

/**
 * Base of the errors raised by the graph store and the components above it.
 * The tool façade turns any of these into an {@code {"error": ...}} payload.
 */
public abstract class GraphException extends RuntimeException {

    protected GraphException(String message) {
        super(message);
    }

    protected GraphException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short label used as the prefix of the error text returned to callers. */
    public abstract String kind();
}
