package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.query.QueryEngine;

import java.util.HashSet;
import java.util.Locale;

public class OpenNodesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final QueryEngine queries;

    public OpenNodesTool(QueryEngine queries) {
        this.queries = queries;
    }

    @Override public String name() { return "open_nodes"; }

    @Override public String description() {
        return "Fetch specific entities by name. Names that do not exist are listed under not_found.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .stringArray("names", "entity names to fetch", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var names = args.requireStringList("names");
        var entities = queries.openNodes(userId, names);

        var found = new HashSet<String>();
        entities.forEach(e -> found.add(e.name().toLowerCase(Locale.ROOT)));
        var node = MAPPER.createObjectNode();
        node.set("entities", MAPPER.valueToTree(entities));
        var notFound = node.putArray("not_found");
        for (var name : names) {
            if (!found.contains(name.trim().toLowerCase(Locale.ROOT))) notFound.add(name);
        }
        return ToolResult.ok(node);
    }
}
