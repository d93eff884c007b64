package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphDelta;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.Relation;

import java.util.ArrayList;
import java.util.List;

public class CreateRelationsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public CreateRelationsTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "create_relations"; }

    @Override public String description() {
        return "Create directed relations between entities, in active voice (e.g. engineer -at-> company). "
                + "Missing endpoint entities are created; duplicates are skipped.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .objectArray("relations", "relations to create", RelationArgs.schema(), true)
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
        var applied = store.apply(userId, new GraphDelta(List.of(), List.of(), relations));

        var result = MAPPER.createObjectNode();
        result.set("created", MAPPER.valueToTree(applied.createdRelations()));
        var skipped = result.putArray("skipped");
        for (var r : applied.existingRelations()) {
            skipped.addObject()
                   .put("from", r.from())
                   .put("type", r.type())
                   .put("to", r.to())
                   .put("reason", "relation already exists");
        }
        return ToolResult.ok(result);
    }
}
