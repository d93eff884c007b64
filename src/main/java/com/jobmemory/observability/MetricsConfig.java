package com.jobmemory.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer toolLatency(String tool) {
        return Timer.builder("jobmemory.tool.latency").tag("tool", tool).register(registry);
    }

    public Counter toolCalls(String tool) {
        return Counter.builder("jobmemory.tool.calls").tag("tool", tool).register(registry);
    }

    public Counter toolErrors(String tool) {
        return Counter.builder("jobmemory.tool.errors").tag("tool", tool).register(registry);
    }
}
