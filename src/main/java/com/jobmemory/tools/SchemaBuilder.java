package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the JSON schema objects tools advertise in {@code inputSchema}.
 */
final class SchemaBuilder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectNode properties = NODES.objectNode();
    private final ArrayNode required = NODES.arrayNode();

    static SchemaBuilder object() {
        return new SchemaBuilder();
    }

    static SchemaBuilder withUserId() {
        return object().string("user_id", "ID of the user whose graph is used", true);
    }

    SchemaBuilder string(String name, String description, boolean isRequired) {
        properties.putObject(name).put("type", "string").put("description", description);
        return require(name, isRequired);
    }

    SchemaBuilder stringArray(String name, String description, boolean isRequired) {
        var prop = properties.putObject(name).put("type", "array").put("description", description);
        prop.putObject("items").put("type", "string");
        return require(name, isRequired);
    }

    SchemaBuilder objectArray(String name, String description, JsonNode itemSchema, boolean isRequired) {
        var prop = properties.putObject(name).put("type", "array").put("description", description);
        prop.set("items", itemSchema);
        return require(name, isRequired);
    }

    ObjectNode build() {
        var schema = NODES.objectNode().put("type", "object");
        schema.set("properties", properties);
        schema.set("required", required);
        return schema;
    }

    private SchemaBuilder require(String name, boolean isRequired) {
        if (isRequired) required.add(name);
        return this;
    }
}
