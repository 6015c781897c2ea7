package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.provider.ContactEnrichmentClient;
import com.leadpilot.orchestrator.provider.ProfessionalNetworkClient;
import com.leadpilot.orchestrator.provider.ProviderException;
import com.leadpilot.orchestrator.provider.dto.Contact;
import com.leadpilot.orchestrator.provider.dto.NetworkProfile;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageDefinition;
import com.leadpilot.orchestrator.stage.StagePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stage 3: find the decision-makers to target.
 *
 * Sources, first non-empty wins:
 *   1. LinkedIn profiles found by title search
 *   2. named people from the contact provider
 *   3. roles given in the request ("Acme, Roles: CTO, VP Sales")
 *   4. typical roles suggested by Claude
 *
 * A transient lookup failure is rethrown so the stage is retried; any other
 * failure falls through to the next source.
 *
 * Each person gets a decision-power score; those at or above
 * {@link DecisionPower#ACCEPT_THRESHOLD} are accepted.
 */
@Component
public class RoleSearchStage extends PromptedStage {

    private static final Logger log = LoggerFactory.getLogger(RoleSearchStage.class);

    public static final String NAME = "roles";

    static final String TARGET_ROLE = "[Target Role]";

    private static final StageDefinition DEFINITION = new StageDefinition(
            NAME, 3, "Find decision-makers and score their buying power", StagePolicy.ABORT);

    private final ProfessionalNetworkClient network;
    private final ContactEnrichmentClient   provider;

    public RoleSearchStage(ClaudeClient claude, StagePrompts prompts, ObjectMapper json,
                           ProfessionalNetworkClient network,
                           ContactEnrichmentClient provider,
                           @Value("${leadpilot.llm.model:claude-sonnet-4-6}") String model) {
        super(claude, prompts, json, model);
        this.network  = network;
        this.provider = provider;
    }

    @Override
    public StageDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode execute(StageContext ctx) {
        String company = ctx.priorResult(DiscoveryStage.NAME).path("name").asText(ctx.request().company());
        String size = ctx.priorResult(DiscoveryStage.NAME).path("size").asText("medium");
        List<ObjectNode> people = new ArrayList<>();

        if (network.isConfigured()) {
            ctx.checkCancelled();
            try {
                for (NetworkProfile p : network.decisionMakers(company, size)) {
                    people.add(person(p.name(), p.title(), p.profileUrl(), "linkedin"));
                }
            } catch (ProviderException e) {
                if (e.isTransient()) {
                    throw e;
                }
                log.warn("LinkedIn search failed for '{}', falling back: {}", company, e.getMessage());
            }
        }

        if (people.isEmpty() && provider.isConfigured()) {
            ctx.checkCancelled();
            try {
                for (Contact c : provider.topPeople(company, 10)) {
                    if (!c.fullName().isEmpty()) {
                        people.add(person(c.fullName(), c.title(), c.linkedin_url(), "apollo"));
                    }
                }
            } catch (ProviderException e) {
                if (e.isTransient()) {
                    throw e;
                }
                log.warn("Provider lookup failed for '{}', falling back: {}", company, e.getMessage());
            }
        }

        if (people.isEmpty()) {
            for (String role : ctx.request().roles()) {
                people.add(person(TARGET_ROLE, role, null, "user_input"));
            }
        }

        if (people.isEmpty()) {
            ObjectNode suggestion = ask(ctx, "Company: %s, Size: %s".formatted(company, size));
            for (JsonNode role : suggestion.path("roles")) {
                if (role.isTextual() && !role.asText().isBlank()) {
                    people.add(person(TARGET_ROLE, role.asText(), null, "suggested"));
                }
            }
        }

        people.sort(Comparator.comparingInt((ObjectNode p) -> p.path("decision_power").asInt()).reversed());
        long accepted = people.stream().filter(p -> "accepted".equals(p.path("status").asText())).count();

        ObjectNode result = json.createObjectNode();
        result.put("company", company);
        result.put("people_found", people.size());
        result.put("accepted_count", accepted);
        result.put("rejected_count", people.size() - accepted);
        ArrayNode arr = result.putArray("people");
        people.forEach(arr::add);
        result.put("summary", "Found %d decision-makers at %s".formatted(accepted, company));

        ctx.note("decision", json.createObjectNode().put("summary", result.path("summary").asText()),
                accepted == 0 ? 8 : 5);
        return result;
    }

    private ObjectNode person(String name, String title, String linkedinUrl, String source) {
        int power = DecisionPower.score(title);
        ObjectNode p = json.createObjectNode();
        p.put("name", name);
        p.put("title", title == null || title.isBlank() ? "Unknown" : title);
        if (linkedinUrl != null && !linkedinUrl.isBlank()) {
            p.put("linkedin_url", linkedinUrl);
        }
        p.put("decision_power", power);
        p.put("status", DecisionPower.accepted(power) ? "accepted" : "rejected");
        p.put("reason", "Decision power: " + power + "/10");
        p.put("source", source);
        return p;
    }
}
