package com.jobmemory.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name to tool lookup, in registration order.
 */
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry register(Tool... toAdd) {
        for (var tool : toAdd) {
            if (tools.containsKey(tool.name())) {
                throw new IllegalArgumentException("Duplicate tool: " + tool.name());
            }
            tools.put(tool.name(), tool);
        }
        return this;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    /** Tool descriptors in the MCP {@code tools/list} shape: name, description, inputSchema. */
    public ArrayNode describe() {
        var list = JsonNodeFactory.instance.arrayNode();
        for (var tool : tools.values()) {
            list.addObject()
                .put("name", tool.name())
                .put("description", tool.description())
                .set("inputSchema", tool.inputSchema());
        }
        return list;
    }
}
