package com.jobmemory.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".jobmemory", "config.yaml"
    );

    public static JobMemoryConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static JobMemoryConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var defaults = JobMemoryConfig.defaults();
        var storeDefaults = defaults.store();
        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var store = (Map<String, Object>) raw.getOrDefault("store", Map.of());
        var extractor = (Map<String, Object>) raw.getOrDefault("extractor", Map.of());
        var recommend = (Map<String, Object>) raw.getOrDefault("recommend", Map.of());

        var storeFile = envOrDefault("JOBMEMORY_STORE_FILE",
            String.valueOf(store.getOrDefault("file", storeDefaults.file().toString())));
        var rulesFile = envOrDefault("JOBMEMORY_RULES_FILE",
            (String) extractor.get("rules-file"));

        return new JobMemoryConfig(
            Integer.parseInt(envOrDefault("JOBMEMORY_PORT",
                String.valueOf(server.getOrDefault("port", defaults.serverPort())))),
            new StoreConfig(
                expandHome(storeFile),
                Long.parseLong(String.valueOf(store.getOrDefault("lock-timeout-ms", storeDefaults.lockTimeoutMs())))
            ),
            rulesFile == null || rulesFile.isBlank() ? null : expandHome(rulesFile),
            Integer.parseInt(String.valueOf(
                recommend.getOrDefault("general-items-per-category", defaults.generalItemsPerCategory())))
        );
    }

    private static Path expandHome(String raw) {
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), raw.substring(2));
        }
        return Path.of(raw);
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
