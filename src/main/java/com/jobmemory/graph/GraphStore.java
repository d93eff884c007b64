package com.jobmemory.graph;

import java.util.Collection;
import java.util.List;

/**
 * Per-user knowledge graph. Every mutating call is durable when it returns;
 * a write that could not be persisted raises
 * {@link com.jobmemory.shared.error.PersistenceException} and leaves the graph unchanged.
 */
public interface GraphStore {

    /** Returns the existing entity untouched, or creates it with no observations. */
    Entity upsertEntity(String userId, String name, String type);

    void addObservation(String userId, String name, String text);

    /** Appends all texts in one write; the entity is created as {@code unknown} if absent. */
    void addObservations(String userId, String name, List<String> texts);

    /** Returns true when the triple was not present before. */
    boolean addRelation(String userId, String from, String relationType, String to);

    ApplyResult apply(String userId, GraphDelta delta);

    /** Removes the entity and every relation touching it. */
    boolean deleteEntity(String userId, String name);

    /** Deletes every named entity in one write; nothing is removed if the write fails. */
    DeleteResult<String> deleteEntities(String userId, List<String> names);

    /** Removes the first occurrence of each text; returns how many were removed. */
    int deleteObservations(String userId, String name, List<String> texts);

    boolean deleteRelation(String userId, String from, String relationType, String to);

    /** Deletes every given relation in one write; nothing is removed if the write fails. */
    DeleteResult<Relation> deleteRelations(String userId, List<Relation> relations);

    /** Drops the whole graph of one user. */
    boolean clear(String userId);

    KnowledgeGraph readGraph(String userId);

    List<Entity> searchNodes(String userId, String query);

    List<Entity> openNodes(String userId, Collection<String> names);
}
