package com.jobmemory.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.graph.JsonFileGraphStore;
import com.jobmemory.observability.MetricsConfig;
import com.jobmemory.query.QueryEngine;
import com.jobmemory.tools.CreateEntitiesTool;
import com.jobmemory.tools.SearchNodesTool;
import com.jobmemory.tools.ToolDispatcher;
import com.jobmemory.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ToolControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private ToolController controller;

    @BeforeEach
    void setUp() {
        var store = new JsonFileGraphStore(tempDir.resolve("graph.json"), Duration.ofSeconds(2));
        var registry = new ToolRegistry().register(new CreateEntitiesTool(store), new SearchNodesTool(new QueryEngine(store)));
        controller = new ToolController(new ToolDispatcher(registry, new MetricsConfig()));
    }

    @Test
    void listsRegisteredTools() {
        var tools = controller.list().get("tools");
        assertEquals(2, tools.size());
        assertEquals("search_nodes", tools.get(1).get("name").asText());
        assertTrue(tools.get(1).get("inputSchema").has("properties"));
    }

    @Test
    void callsToolByName() throws Exception {
        controller.call("create_entities", MAPPER.readTree(
                "{\"user_id\":\"u1\",\"entities\":[{\"name\":\"Redis\",\"type\":\"skill\"}]}"));

        var response = controller.call("search_nodes", MAPPER.readTree("{\"user_id\":\"u1\",\"query\":\"red\"}"));

        assertEquals(200, response.getStatusCode().value());
        assertEquals(1, response.getBody().get("count").asInt());
    }

    @Test
    void toolErrorsComeBackAsPayload() {
        var response = controller.call("missing_tool", null);
        assertEquals("Unknown tool: missing_tool", response.getBody().get("error").asText());
    }
}
