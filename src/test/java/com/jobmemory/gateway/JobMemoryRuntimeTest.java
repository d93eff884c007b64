package com.jobmemory.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.shared.config.JobMemoryConfig;
import com.jobmemory.shared.config.StoreConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobMemoryRuntimeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void registersTheFullToolSet() {
        var runtime = JobMemoryRuntime.create(config(tempDir.resolve("graph.json")));

        var names = new HashSet<String>();
        runtime.dispatcher().registry().all().forEach(t -> names.add(t.name()));
        assertEquals(Set.of("process_user_message", "get_job_recommendations", "create_entities",
                "create_relations", "add_observations", "read_graph", "search_nodes", "open_nodes",
                "delete_entities", "delete_observations", "delete_relations"), names);
    }

    @Test
    void messageToRecommendationFlow() throws Exception {
        var file = tempDir.resolve("data/graph.json");
        var runtime = JobMemoryRuntime.create(config(file));
        var dispatcher = runtime.dispatcher();

        dispatcher.call("process_user_message", MAPPER.readTree(
                "{\"user_id\":\"u1\",\"message\":\"我在阿里做Java开发，想去腾讯面试\"}"));
        var rec = dispatcher.call("get_job_recommendations", MAPPER.readTree(
                "{\"user_id\":\"u1\",\"recommendation_type\":\"interview\"}"));

        assertFalse(rec.isError());
        assertTrue(rec.output().contains("Research 腾讯"));
        assertTrue(Files.exists(file));

        var reopened = JobMemoryRuntime.create(config(file));
        assertFalse(reopened.store().readGraph("u1").isEmpty());
        assertTrue(runtime.metrics().toolCalls("process_user_message").count() >= 1.0);
    }

    private static JobMemoryConfig config(Path file) {
        return new JobMemoryConfig(0, new StoreConfig(file, 2_000), null, 2);
    }
}
