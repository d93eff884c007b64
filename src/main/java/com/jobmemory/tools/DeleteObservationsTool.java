package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphStore;

public class DeleteObservationsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public DeleteObservationsTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "delete_observations"; }

    @Override public String description() {
        return "Remove specific observations from an existing entity. One occurrence is removed per given text.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .string("name", "entity name", true)
                .stringArray("observations", "exact observation texts to remove", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var name = args.requireString("name");
        int removed = store.deleteObservations(userId, name, args.requireStringList("observations"));
        return ToolResult.ok(MAPPER.createObjectNode()
                .put("entity", name)
                .put("removed", removed));
    }
}
