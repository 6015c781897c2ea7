package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.provider.WebSearchClient;
import com.leadpilot.orchestrator.provider.dto.CompanyResearch;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageDefinition;
import com.leadpilot.orchestrator.stage.StagePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Stage 1: validate the company as a B2B target.
 *
 * A "rejected" verdict is a successful stage result that ends the pipeline.
 * When web search is configured the verdict is grounded in live search
 * results; otherwise the model judges from the company name alone.
 */
@Component
public class DiscoveryStage extends PromptedStage {

    public static final String NAME = "discovery";

    static final String ACCEPTED = "accepted";
    static final String REJECTED = "rejected";

    private static final StageDefinition DEFINITION = new StageDefinition(
            NAME, 1, "Validate the company for B2B suitability", StagePolicy.ABORT);

    private final WebSearchClient search;

    public DiscoveryStage(ClaudeClient claude, StagePrompts prompts, ObjectMapper json,
                          WebSearchClient search,
                          @Value("${leadpilot.llm.model:claude-sonnet-4-6}") String model) {
        super(claude, prompts, json, model);
        this.search = search;
    }

    @Override
    public StageDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode execute(StageContext ctx) {
        String company = ctx.request().company();
        ctx.checkCancelled();
        CompanyResearch research = search.isConfigured() ? search.researchCompany(company) : null;

        ObjectNode result;
        if (research != null && !research.isEmpty()) {
            result = ask(ctx, "Analyze this company based on the following REAL search results:\n\n"
                    + research.render());
            research.sources().forEach(result.putArray("sources")::add);
        } else {
            result = ask(ctx, "Company: " + company);
        }

        if (!result.hasNonNull("name") || result.path("name").asText().isBlank()) {
            result.put("name", company);
        }
        String status = result.path("status").asText("").strip().toLowerCase(Locale.ROOT);
        if (!ACCEPTED.equals(status) && !REJECTED.equals(status)) {
            result.put("reason", "Unrecognised discovery status '" + status + "'");
            status = REJECTED;
        }
        result.put("status", status);

        ObjectNode note = json.createObjectNode()
                .put("summary", "Discovery " + status + " " + result.path("name").asText()
                        + ": " + result.path("reason").asText(""));
        ctx.note("decision", note, REJECTED.equals(status) ? 8 : 6);
        return result;
    }

    @Override
    public boolean endsPipeline(JsonNode result) {
        return REJECTED.equals(result.path("status").asText());
    }
}
