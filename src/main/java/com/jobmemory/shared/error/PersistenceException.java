package com.jobmemory.shared.error;

/**
 * The backing file could not be read or written, or its lock could not be
 * acquired in time. A write that raised this was not applied.
 */
public class PersistenceException extends GraphException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override public String kind() { return "persistence"; }
}
