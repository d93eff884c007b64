package com.jobmemory.shared.error;

/**
 * Concurrent modification detected. Reserved for optimistic versioning; the
 * single-lock store never raises it.
 */
public class ConflictException extends GraphException {

    public ConflictException(String message) {
        super(message);
    }

    @Override public String kind() { return "conflict"; }
}
