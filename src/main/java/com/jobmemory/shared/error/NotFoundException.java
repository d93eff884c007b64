package com.jobmemory.shared.error;

/**
 * An operation required an entity to exist already and it did not.
 */
public class NotFoundException extends GraphException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override public String kind() { return "not_found"; }
}
