package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {
    String name();
    String description();
    JsonNode inputSchema();

    /**
     * Runs the tool. Component errors may be thrown as
     * {@link com.jobmemory.shared.error.GraphException}; the dispatcher formats them.
     */
    ToolResult execute(ToolContext ctx, JsonNode input);
}
