package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.Relation;

import java.util.ArrayList;

public class DeleteRelationsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public DeleteRelationsTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "delete_relations"; }

    @Override public String description() {
        return "Delete relations from the user's knowledge graph. Entities are kept.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .objectArray("relations", "relations to delete", RelationArgs.schema(), true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var relations = new ArrayList<Relation>();
        for (var r : args.requireObjectList("relations")) {
            relations.add(RelationArgs.read(r));
        }
        var outcome = store.deleteRelations(userId, relations);

        var result = MAPPER.createObjectNode();
        result.set("deleted", MAPPER.valueToTree(outcome.deleted()));
        result.set("not_found", MAPPER.valueToTree(outcome.notFound()));
        return ToolResult.ok(result);
    }
}
