package com.jobmemory.gateway;

import com.jobmemory.shared.config.ConfigLoader;
import com.jobmemory.shared.config.JobMemoryConfig;
import com.jobmemory.tools.ToolDispatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfig {

    @Bean
    public JobMemoryConfig jobMemoryConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public JobMemoryRuntime jobMemoryRuntime(JobMemoryConfig config) {
        return JobMemoryRuntime.create(config);
    }

    @Bean
    public ToolDispatcher toolDispatcher(JobMemoryRuntime runtime) {
        return runtime.dispatcher();
    }
}
