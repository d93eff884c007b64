package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphStore;

public class DeleteEntitiesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public DeleteEntitiesTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "delete_entities"; }

    @Override public String description() {
        return "Delete entities and every relation that references them.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .stringArray("names", "names of the entities to delete", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var outcome = store.deleteEntities(userId, args.requireStringList("names"));

        var result = MAPPER.createObjectNode();
        result.set("deleted", MAPPER.valueToTree(outcome.deleted()));
        result.set("not_found", MAPPER.valueToTree(outcome.notFound()));
        return ToolResult.ok(result);
    }
}
