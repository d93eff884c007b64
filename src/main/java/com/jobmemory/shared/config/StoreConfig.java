package com.jobmemory.shared.config;

import java.nio.file.Path;
import java.time.Duration;

public record StoreConfig(
    Path file,
    long lockTimeoutMs
) {
    public static StoreConfig defaults() {
        return new StoreConfig(
            Path.of(System.getProperty("user.home"), ".jobmemory", "knowledge_graph.json"), 5_000);
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }
}
