package com.jobmemory.gateway.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobmemory.tools.ToolContext;
import com.jobmemory.tools.ToolDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ToolController {

    private final ToolDispatcher dispatcher;

    public ToolController(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/v1/tools")
    public Map<String, JsonNode> list() {
        return Map.of("tools", dispatcher.registry().describe());
    }

    /** Tool errors come back as 200 with an {@code error} field, same as over MCP. */
    @PostMapping("/v1/tools/{name}")
    public ResponseEntity<JsonNode> call(@PathVariable String name,
                                         @RequestBody(required = false) JsonNode arguments) {
        var result = dispatcher.call(ToolContext.of("http"), name, arguments);
        return ResponseEntity.ok(result.content());
    }
}
