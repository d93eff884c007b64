package com.jobmemory.gateway;

import com.jobmemory.mcp.McpServer;
import com.jobmemory.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.util.Arrays;
import java.util.Map;

/**
 * Entry point. {@code --stdio} serves MCP on stdin/stdout without starting the web
 * server; otherwise the HTTP gateway starts on the configured port.
 */
@SpringBootApplication(scanBasePackages = "com.jobmemory.gateway")
public class JobMemoryApp {

    private static final Logger log = LoggerFactory.getLogger(JobMemoryApp.class);
    static final String VERSION = "0.1.0";

    public static void main(String[] args) throws IOException {
        var config = ConfigLoader.load();

        if (Arrays.asList(args).contains("--stdio")) {
            var runtime = JobMemoryRuntime.create(config);
            new McpServer(runtime.dispatcher(), "job-memory", VERSION).serve(System.in, System.out);
            return;
        }

        var app = new SpringApplication(JobMemoryApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.run(args);
        log.info("Job memory gateway started on port {}, store {}", config.serverPort(), config.store().file());
    }
}
