package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.extract.ObservationExtractor;
import com.jobmemory.graph.GraphDelta;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.ObservationFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;

public class ProcessUserMessageTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ProcessUserMessageTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PROFILE_ENTITY = "profile";
    static final String PROFILE_TYPE = "user";

    private final ObservationExtractor extractor;
    private final GraphStore store;
    private final Clock clock;

    public ProcessUserMessageTool(ObservationExtractor extractor, GraphStore store, Clock clock) {
        this.extractor = extractor;
        this.store = store;
        this.clock = clock;
    }

    @Override public String name() { return "process_user_message"; }

    @Override public String description() {
        return "Extract job-search facts (skills, roles, companies, preferences) from a user message "
                + "and store them in that user's knowledge graph. Messages unrelated to job search are ignored.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .string("message", "the user's message", true)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var message = args.requireString("message");

        var result = MAPPER.createObjectNode();
        if (!extractor.isJobRelated(message)) {
            log.debug("Skipping message for user {}: not job related", userId);
            return ToolResult.ok(result.put("status", "skipped").put("reason", "message is not related to job search"));
        }

        var delta = extractor.extract(userId, message);
        var stamped = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS) + " " + message.trim();
        var observations = new ArrayList<>(delta.observations());
        observations.add(new ObservationFact(PROFILE_ENTITY, PROFILE_TYPE, stamped));
        store.apply(userId, new GraphDelta(delta.entities(), observations, delta.relations()));

        result.put("status", "stored");
        var facts = result.putArray("observations");
        for (var fact : delta.observations()) {
            facts.addObject()
                 .put("entity", fact.entityName())
                 .put("type", fact.entityType())
                 .put("text", fact.text());
        }
        result.set("relations", MAPPER.valueToTree(delta.relations()));
        return ToolResult.ok(result);
    }
}
