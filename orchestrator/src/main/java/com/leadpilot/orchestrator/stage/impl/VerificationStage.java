package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageDefinition;
import com.leadpilot.orchestrator.stage.StageFailure;
import com.leadpilot.orchestrator.stage.StagePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Stage 5: score the lead and decide verified / rejected.
 *
 * A score below {@link #MIN_CONFIDENCE} always yields "rejected", whatever
 * status Claude chose. If Claude's answer cannot be parsed the score is
 * computed locally from the same rules the prompt describes.
 */
@Component
public class VerificationStage extends PromptedStage {

    private static final Logger log = LoggerFactory.getLogger(VerificationStage.class);

    public static final String NAME = "verification";

    static final double MIN_CONFIDENCE = 0.7;

    private static final StageDefinition DEFINITION = new StageDefinition(
            NAME, 5, "Score the lead and decide whether to pursue it", StagePolicy.ABORT);

    public VerificationStage(ClaudeClient claude, StagePrompts prompts, ObjectMapper json,
                             @Value("${leadpilot.llm.model:claude-sonnet-4-6}") String model) {
        super(claude, prompts, json, model);
    }

    @Override
    public StageDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode execute(StageContext ctx) {
        JsonNode company  = ctx.priorResult(DiscoveryStage.NAME);
        JsonNode contacts = ctx.priorResult(EnrichmentStage.NAME).path("contacts");
        String name = company.path("name").asText(ctx.request().company());

        if (DiscoveryStage.REJECTED.equals(company.path("status").asText())) {
            return rejection(0.0, "Company rejected: " + company.path("reason").asText("Not suitable"),
                    name + " - Company not suitable for B2B");
        }
        ArrayNode accepted = json.createArrayNode();
        for (JsonNode p : ctx.priorResult(RoleSearchStage.NAME).path("people")) {
            if ("accepted".equals(p.path("status").asText())) {
                accepted.add(p);
            }
        }
        if (accepted.isEmpty()) {
            return rejection(0.3, "No decision-makers found", name + " - No high-value targets");
        }

        String request = """
                Company: %s

                Accepted roles (%d):
                %s

                Enriched contacts (%d):
                %s
                """.formatted(company.toPrettyString(), accepted.size(), accepted.toPrettyString(),
                contacts.size(), contacts.toPrettyString());

        ObjectNode result;
        try {
            result = ask(ctx, request);
        } catch (StageFailure e) {
            if (e.getKind() != StageFailure.Kind.PARSE_ERROR) {
                throw e;
            }
            log.warn("Unparseable verification answer, scoring locally: {}", e.getMessage());
            result = localScore(company, accepted, contacts, name);
        }

        double score = result.path("confidence_score").asDouble(0.0);
        result.put("confidence_score", score);
        String status = result.path("status").asText("").toLowerCase(Locale.ROOT);
        if (score < MIN_CONFIDENCE || !"verified".equals(status)) {
            status = "rejected";
        }
        result.put("status", status);

        ctx.note("decision", json.createObjectNode()
                .put("summary", "Lead %s with confidence %.2f".formatted(status, score)), 9);
        return result;
    }

    private ObjectNode localScore(JsonNode company, ArrayNode accepted, JsonNode contacts, String name) {
        double score = 0.5;
        if (DiscoveryStage.ACCEPTED.equals(company.path("status").asText())) score += 0.2;
        if (!accepted.isEmpty())                                               score += 0.2;
        if (!contacts.isEmpty())                                               score += 0.1;
        for (JsonNode c : contacts) {
            if (!c.path("email").asText("").isBlank()) {
                score += 0.05;
                break;
            }
        }
        score = Math.min(1.0, Math.round(score * 100) / 100.0);
        boolean ok = score >= MIN_CONFIDENCE;
        ObjectNode r = json.createObjectNode();
        r.put("status", ok ? "verified" : "rejected");
        r.put("confidence_score", score);
        r.put("reason", "Calculated based on available data");
        r.put("summary", "%s - %d decision-makers, %d contacts".formatted(name, accepted.size(), contacts.size()));
        r.put("recommended_action", ok ? "Proceed with outreach" : "Gather more data");
        return r;
    }

    private ObjectNode rejection(double score, String reason, String summary) {
        ObjectNode r = json.createObjectNode();
        r.put("status", "rejected");
        r.put("confidence_score", score);
        r.put("reason", reason);
        r.put("summary", summary);
        return r;
    }
}
