package com.jobmemory.graph;

/**
 * A text to append to an entity, with the type to give the entity if it is new.
 */
public record ObservationFact(String entityName, String entityType, String text) {}
