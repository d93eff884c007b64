package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jobmemory.graph.UserIds;
import com.jobmemory.shared.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed reads over a tool's JSON arguments. Every accessor checks presence and
 * JSON type and reports failures as {@link ValidationException} with the field path.
 */
public final class ToolArguments {

    private final JsonNode node;
    private final String path;

    private ToolArguments(JsonNode node, String path) {
        this.node = node;
        this.path = path;
    }

    public static ToolArguments of(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return new ToolArguments(JsonNodeFactory.instance.objectNode(), "");
        }
        if (!input.isObject()) throw new ValidationException("arguments must be a JSON object");
        return new ToolArguments(input, "");
    }

    public String userId() {
        return UserIds.validate(requireString("user_id"));
    }

    /** First present field among {@code name} and its aliases, which must be a non-blank string. */
    public String requireString(String name, String... aliases) {
        var value = optionalString(name, aliases);
        if (value == null) throw new ValidationException(field(name) + " is required");
        if (value.isBlank()) throw new ValidationException(field(name) + " must not be empty");
        return value;
    }

    public String optionalString(String name, String... aliases) {
        var found = name;
        var value = node.get(name);
        for (int i = 0; (value == null || value.isNull()) && i < aliases.length; i++) {
            found = aliases[i];
            value = node.get(found);
        }
        if (value == null || value.isNull()) return null;
        if (!value.isTextual()) throw new ValidationException(field(found) + " must be a string");
        return value.asText();
    }

    public List<String> requireStringList(String name) {
        var array = requireArray(name);
        var out = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            var item = array.get(i);
            if (!item.isTextual()) throw new ValidationException(field(name) + "[" + i + "] must be a string");
            out.add(item.asText());
        }
        return out;
    }

    public List<String> optionalStringList(String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) return List.of();
        return requireStringList(name);
    }

    public List<ToolArguments> requireObjectList(String name) {
        var array = requireArray(name);
        var out = new ArrayList<ToolArguments>(array.size());
        for (int i = 0; i < array.size(); i++) {
            var item = array.get(i);
            var itemPath = field(name) + "[" + i + "]";
            if (!item.isObject()) throw new ValidationException(itemPath + " must be an object");
            out.add(new ToolArguments(item, itemPath + "."));
        }
        return out;
    }

    private JsonNode requireArray(String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) throw new ValidationException(field(name) + " is required");
        if (!value.isArray()) throw new ValidationException(field(name) + " must be an array");
        if (value.isEmpty()) throw new ValidationException(field(name) + " must not be empty");
        return value;
    }

    private String field(String name) {
        return path + name;
    }
}
