package com.jobmemory.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Snapshot of one user's graph, also the per-user shape of the persisted file.
 */
public record KnowledgeGraph(List<Entity> entities, List<Relation> relations) {

    public KnowledgeGraph {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    public static KnowledgeGraph empty() {
        return new KnowledgeGraph(List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty() && relations.isEmpty();
    }
}
