package com.jobmemory.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"));
        var defaults = JobMemoryConfig.defaults();

        if (System.getenv("JOBMEMORY_PORT") == null) assertEquals(defaults.serverPort(), config.serverPort());
        if (System.getenv("JOBMEMORY_STORE_FILE") == null) assertEquals(defaults.store().file(), config.store().file());
        assertEquals(5_000, config.store().lockTimeoutMs());
        assertEquals(2, config.generalItemsPerCategory());
    }

    @Test
    void readsAllSections() throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                server:
                  port: 9001
                store:
                  file: ~/graphs/kg.json
                  lock-timeout-ms: 750
                extractor:
                  rules-file: /etc/jobmemory/rules.yaml
                recommend:
                  general-items-per-category: 3
                """);

        var config = ConfigLoader.load(file);

        if (System.getenv("JOBMEMORY_PORT") == null) assertEquals(9001, config.serverPort());
        if (System.getenv("JOBMEMORY_STORE_FILE") == null) {
            assertEquals(Path.of(System.getProperty("user.home"), "graphs", "kg.json"), config.store().file());
        }
        if (System.getenv("JOBMEMORY_RULES_FILE") == null) {
            assertEquals(Path.of("/etc/jobmemory/rules.yaml"), config.rulesFile());
        }
        assertEquals(750, config.store().lockTimeout().toMillis());
        assertEquals(3, config.generalItemsPerCategory());
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        var file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        var config = ConfigLoader.load(file);

        if (System.getenv("JOBMEMORY_RULES_FILE") == null) assertNull(config.rulesFile());
        assertEquals(2, config.generalItemsPerCategory());
    }
}
