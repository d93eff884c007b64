package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.query.QueryEngine;

public class SearchNodesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final QueryEngine queries;

    public SearchNodesTool(QueryEngine queries) {
        this.queries = queries;
    }

    @Override public String name() { return "search_nodes"; }

    @Override public String description() {
        return "Find entities whose name, type or observations contain the query (case-insensitive).";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .string("query", "text matched against entity names, types and observations", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var query = args.requireString("query");
        var results = queries.searchNodes(userId, query);

        var node = MAPPER.createObjectNode().put("query", query);
        node.set("results", MAPPER.valueToTree(results));
        node.put("count", results.size());
        return ToolResult.ok(node);
    }
}
