package com.jobmemory.graph;

import java.util.Objects;

/**
 * Directed typed edge. The triple is the identity.
 */
public record Relation(String from, String type, String to) {

    public Relation {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(to, "to");
    }
}
