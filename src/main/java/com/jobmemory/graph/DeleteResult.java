package com.jobmemory.graph;

import java.util.List;

/**
 * Outcome of a batch delete: the items that were removed and those that were not there.
 */
public record DeleteResult<T>(List<T> deleted, List<T> notFound) {

    public DeleteResult {
        deleted = List.copyOf(deleted);
        notFound = List.copyOf(notFound);
    }
}
