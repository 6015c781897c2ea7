package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageDefinition;
import com.leadpilot.orchestrator.stage.StagePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stage 2: map departments and the decision-makers in each.
 *
 * Informational only; later stages work without it, so failures do not abort the run.
 */
@Component
public class StructureStage extends PromptedStage {

    public static final String NAME = "structure";

    private static final StageDefinition DEFINITION = new StageDefinition(
            NAME, 2, "Map departments and decision-making levels", StagePolicy.CONTINUE);

    public StructureStage(ClaudeClient claude, StagePrompts prompts, ObjectMapper json,
                          @Value("${leadpilot.llm.model:claude-sonnet-4-6}") String model) {
        super(claude, prompts, json, model);
    }

    @Override
    public StageDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode execute(StageContext ctx) {
        JsonNode discovery = ctx.priorResult(DiscoveryStage.NAME);
        String company  = discovery.path("name").asText(ctx.request().company());
        String industry = discovery.path("industry").asText("unknown");
        String size     = discovery.path("size").asText("medium");

        ObjectNode result = ask(ctx, "Company: %s, Industry: %s, Size: %s".formatted(company, industry, size));
        if (!result.path("departments").isArray()) {
            result.putArray("departments");
        }
        if (!result.hasNonNull("company_size")) {
            result.put("company_size", size);
        }
        return result;
    }
}
