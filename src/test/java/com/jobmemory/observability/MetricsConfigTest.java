package com.jobmemory.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsConfigTest {

    @Test
    void metersAreTaggedPerTool() {
        var registry = new SimpleMeterRegistry();
        var config = new MetricsConfig(registry);
        config.toolCalls("read_graph").increment();
        config.toolCalls("read_graph").increment();
        config.toolCalls("search_nodes").increment();

        assertEquals(2.0, registry.get("jobmemory.tool.calls").tag("tool", "read_graph").counter().count());
        assertEquals(1.0, config.toolCalls("search_nodes").count());
        assertEquals(0.0, config.toolErrors("read_graph").count());
    }

    @Test
    void defaultRegistryIsSimple() {
        var config = new MetricsConfig();
        assertInstanceOf(SimpleMeterRegistry.class, config.registry());
        assertNotNull(config.toolLatency("read_graph"));
    }
}
