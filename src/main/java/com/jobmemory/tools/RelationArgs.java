package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobmemory.graph.Relation;

final class RelationArgs {

    private RelationArgs() {}

    static JsonNode schema() {
        return SchemaBuilder.object()
                .string("from", "name of the source entity", true)
                .string("type", "relation type", true)
                .string("to", "name of the target entity", true)
                .build();
    }

    static Relation read(ToolArguments r) {
        return new Relation(
                r.requireString("from"),
                r.requireString("type", "relationType"),
                r.requireString("to"));
    }
}
