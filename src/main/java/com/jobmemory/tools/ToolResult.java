package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * JSON payload of a tool call. Errors always have the shape {@code {"error": "..."}}.
 */
public record ToolResult(JsonNode content, boolean isError) {

    public static ToolResult ok(JsonNode content) {
        return new ToolResult(content, false);
    }

    public static ToolResult error(String message) {
        var node = JsonNodeFactory.instance.objectNode();
        node.put("error", message != null ? message : "unknown error");
        return new ToolResult(node, true);
    }

    /** The payload as compact JSON text. */
    public String output() {
        return content.toString();
    }
}
