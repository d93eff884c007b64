package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.GraphDelta;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.ObservationFact;

import java.util.ArrayList;
import java.util.List;

public class CreateEntitiesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final GraphStore store;

    public CreateEntitiesTool(GraphStore store) {
        this.store = store;
    }

    @Override public String name() { return "create_entities"; }

    @Override public String description() {
        return "Create entities in the user's knowledge graph. Existing entities keep their type; "
                + "given observations are appended.";
    }

    @Override public JsonNode inputSchema() {
        var entity = SchemaBuilder.object()
                .string("name", "entity name", true)
                .string("type", "entity type, e.g. skill, company, role", true)
                .stringArray("observations", "facts about the entity", false)
                .build();
        return SchemaBuilder.withUserId()
                .objectArray("entities", "entities to create", entity, true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var decls = new ArrayList<GraphDelta.EntityDecl>();
        var facts = new ArrayList<ObservationFact>();
        for (var e : args.requireObjectList("entities")) {
            var name = e.requireString("name");
            var type = e.requireString("type", "entityType");
            decls.add(new GraphDelta.EntityDecl(name, type));
            for (var text : e.optionalStringList("observations")) {
                facts.add(new ObservationFact(name, type, text));
            }
        }
        var applied = store.apply(userId, new GraphDelta(decls, facts, List.of()));

        var result = MAPPER.createObjectNode();
        result.set("created", MAPPER.valueToTree(applied.entities()));
        result.put("count", applied.entities().size());
        return ToolResult.ok(result);
    }
}
