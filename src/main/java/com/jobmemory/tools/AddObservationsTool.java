package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphStore;

public class AddObservationsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public AddObservationsTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "add_observations"; }

    @Override public String description() {
        return "Append observations to an entity, creating it with type 'unknown' if it does not exist.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .string("name", "entity name", true)
                .stringArray("observations", "observation texts to append", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var name = args.requireString("name");
        var texts = args.requireStringList("observations");
        store.addObservations(userId, name, texts);
        return ToolResult.ok(MAPPER.createObjectNode()
                .put("entity", name)
                .put("added", texts.size()));
    }
}
