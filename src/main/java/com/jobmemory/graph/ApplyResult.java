package com.jobmemory.graph;

import java.util.List;

/**
 * Outcome of {@link GraphStore#apply}.
 *
 * @param entities          names of the declared entities as stored
 * @param observationsAdded number of observation texts appended
 * @param createdRelations  relations that were new
 * @param existingRelations relations that were already present
 */
public record ApplyResult(List<String> entities,
                          int observationsAdded,
                          List<Relation> createdRelations,
                          List<Relation> existingRelations) {}
