package com.jobmemory.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Additions applied to one user's graph in a single write.
 *
 * @param entities     entities to upsert, in order
 * @param observations observations to append, creating their entity when absent
 * @param relations    relations to insert, creating missing endpoints
 */
public record GraphDelta(List<EntityDecl> entities,
                         List<ObservationFact> observations,
                         List<Relation> relations) {

    public GraphDelta {
        entities = entities == null ? List.of() : List.copyOf(entities);
        observations = observations == null ? List.of() : List.copyOf(observations);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    public static GraphDelta empty() {
        return new GraphDelta(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty() && observations.isEmpty() && relations.isEmpty();
    }

    public record EntityDecl(String name, String type) {}
}
