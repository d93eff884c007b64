package com.jobmemory.graph;

import java.util.List;

/**
 * Immutable view of a graph node. Instances handed out by the store are
 * copies; mutating the store never changes one already returned.
 */
public record Entity(String name, String type, List<String> observations) {

    public Entity {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }
}
