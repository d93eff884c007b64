package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.query.QueryEngine;

public class ReadGraphTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final QueryEngine queries;

    public ReadGraphTool(QueryEngine queries) {
        this.queries = queries;
    }

    @Override public String name() { return "read_graph"; }

    @Override public String description() {
        return "Read the user's whole knowledge graph: all entities and relations.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId().build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var userId = ToolArguments.of(input).userId();
        return ToolResult.ok(MAPPER.valueToTree(queries.readGraph(userId)));
    }
}
