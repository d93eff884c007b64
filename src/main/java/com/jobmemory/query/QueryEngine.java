package com.jobmemory.query;

import com.jobmemory.graph.Entity;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.KnowledgeGraph;

import java.util.Collection;
import java.util.List;

/**
 * Read-only access to a user's graph. Holds no state of its own; ordering is
 * entity creation order throughout.
 */
public class QueryEngine {

    private final GraphStore store;

    public QueryEngine(GraphStore store) {
        this.store = store;
    }

    public KnowledgeGraph readGraph(String userId) {
        return store.readGraph(userId);
    }

    public List<Entity> searchNodes(String userId, String query) {
        return store.searchNodes(userId, query);
    }

    public List<Entity> openNodes(String userId, Collection<String> names) {
        return store.openNodes(userId, names);
    }

    public List<Entity> entitiesOfType(String userId, String type) {
        return entitiesOfType(readGraph(userId), type);
    }

    public static List<Entity> entitiesOfType(KnowledgeGraph graph, String type) {
        return graph.entities().stream()
                .filter(e -> e.type().equalsIgnoreCase(type))
                .toList();
    }
}
