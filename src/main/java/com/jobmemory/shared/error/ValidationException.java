package com.jobmemory.shared.error;

/**
 * Missing or malformed arguments: blank text, bad user id, wrong JSON type.
 */
public class ValidationException extends GraphException {

    public ValidationException(String message) {
        super(message);
    }

    @Override public String kind() { return "validation"; }
}
