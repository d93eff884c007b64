package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobmemory.observability.MetricsConfig;
import com.jobmemory.shared.error.GraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tool calls by name. Every failure comes back as a {@link ToolResult#error}
 * payload; no exception escapes to the transport.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final MetricsConfig metrics;

    public ToolDispatcher(ToolRegistry registry, MetricsConfig metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    public ToolRegistry registry() { return registry; }

    public ToolResult call(String name, JsonNode arguments) {
        return call(ToolContext.of("direct"), name, arguments);
    }

    public ToolResult call(ToolContext ctx, String name, JsonNode arguments) {
        var tool = registry.find(name);
        if (tool.isEmpty()) {
            log.warn("[{}] Unknown tool requested: {}", ctx.channel(), name);
            return ToolResult.error("Unknown tool: " + name);
        }
        metrics.toolCalls(name).increment();
        return metrics.toolLatency(name).record(() -> execute(ctx, tool.get(), arguments));
    }

    private ToolResult execute(ToolContext ctx, Tool tool, JsonNode arguments) {
        try {
            var result = tool.execute(ctx, arguments);
            log.debug("[{}] {} -> {}", ctx.requestId(), tool.name(), result.isError() ? "error" : "ok");
            return result;
        } catch (GraphException e) {
            metrics.toolErrors(tool.name()).increment();
            log.warn("[{}] {} failed: {}: {}", ctx.requestId(), tool.name(), e.kind(), e.getMessage());
            return ToolResult.error(e.kind() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            metrics.toolErrors(tool.name()).increment();
            log.error("[{}] {} failed unexpectedly", ctx.requestId(), tool.name(), e);
            return ToolResult.error("internal error: " + e.getMessage());
        }
    }
}
