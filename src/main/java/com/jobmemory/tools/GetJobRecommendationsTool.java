package com.jobmemory.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.recommend.RecommendationSynthesizer;
import com.jobmemory.recommend.RecommendationType;

public class GetJobRecommendationsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final RecommendationSynthesizer synthesizer;

    public GetJobRecommendationsTool(RecommendationSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    @Override public String name() { return "get_job_recommendations"; }

    @Override public String description() {
        return "Give job-search advice built from what is stored about the user.";
    }

    @Override public JsonNode inputSchema() {
        return SchemaBuilder.withUserId()
                .string("recommendation_type", "one of general, resume, interview, skills (default general)", false)
                .build();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var args = ToolArguments.of(input);
        var userId = args.userId();
        var type = RecommendationType.fromWire(args.optionalString("recommendation_type"));
        return ToolResult.ok(MAPPER.valueToTree(synthesizer.recommend(userId, type)));
    }
}
