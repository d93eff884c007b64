package com.jobmemory.gateway;

import com.jobmemory.extract.ObservationExtractor;
import com.jobmemory.extract.RuleTableLoader;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.JsonFileGraphStore;
import com.jobmemory.observability.MetricsConfig;
import com.jobmemory.query.QueryEngine;
import com.jobmemory.recommend.RecommendationSynthesizer;
import com.jobmemory.shared.config.JobMemoryConfig;
import com.jobmemory.tools.AddObservationsTool;
import com.jobmemory.tools.CreateEntitiesTool;
import com.jobmemory.tools.CreateRelationsTool;
import com.jobmemory.tools.DeleteEntitiesTool;
import com.jobmemory.tools.DeleteObservationsTool;
import com.jobmemory.tools.DeleteRelationsTool;
import com.jobmemory.tools.GetJobRecommendationsTool;
import com.jobmemory.tools.OpenNodesTool;
import com.jobmemory.tools.ProcessUserMessageTool;
import com.jobmemory.tools.ReadGraphTool;
import com.jobmemory.tools.SearchNodesTool;
import com.jobmemory.tools.ToolDispatcher;
import com.jobmemory.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires store, extractor, query engine and synthesizer behind the tool dispatcher.
 * Both the stdio server and the HTTP gateway run on one of these.
 */
public final class JobMemoryRuntime {

    private static final Logger log = LoggerFactory.getLogger(JobMemoryRuntime.class);

    private final GraphStore store;
    private final ToolDispatcher dispatcher;
    private final MetricsConfig metrics;

    private JobMemoryRuntime(GraphStore store, ToolDispatcher dispatcher, MetricsConfig metrics) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public static JobMemoryRuntime create(JobMemoryConfig config) {
        var storeConfig = config.store();
        var store = new JsonFileGraphStore(storeConfig.file(), storeConfig.lockTimeout());
        return create(store, new ObservationExtractor(RuleTableLoader.loadOrDefault(config.rulesFile())),
                config.generalItemsPerCategory(), Clock.systemUTC(), new MetricsConfig());
    }

    public static JobMemoryRuntime create(GraphStore store, ObservationExtractor extractor,
                                          int generalItemsPerCategory, Clock clock, MetricsConfig metrics) {
        var queries = new QueryEngine(store);
        var synthesizer = new RecommendationSynthesizer(queries, generalItemsPerCategory);

        var registry = new ToolRegistry().register(
            new ProcessUserMessageTool(extractor, store, clock),
            new GetJobRecommendationsTool(synthesizer),
            new CreateEntitiesTool(store),
            new CreateRelationsTool(store),
            new AddObservationsTool(store),
            new ReadGraphTool(queries),
            new SearchNodesTool(queries),
            new OpenNodesTool(queries),
            new DeleteEntitiesTool(store),
            new DeleteObservationsTool(store),
            new DeleteRelationsTool(store)
        );
        log.info("Registered {} tools", registry.all().size());
        return new JobMemoryRuntime(store, new ToolDispatcher(registry, metrics), metrics);
    }

    public GraphStore store() { return store; }

    public ToolDispatcher dispatcher() { return dispatcher; }

    public MetricsConfig metrics() { return metrics; }
}
