package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives long-term facts from a finished Execution.
 *
 * Only stages that completed with data contribute. Importance reflects how
 * useful a fact is to later runs: verification outcome and contacts rank
 * highest, descriptive attributes lower.
 */
public final class FactExtractor {

    public static final String ALIASES          = "aliases";
    public static final String INDUSTRY         = "industry";
    public static final String SIZE             = "size";
    public static final String LOCATION         = "location";
    public static final String WEBSITE          = "website";
    public static final String DISCOVERY_STATUS = "discovery_status";
    public static final String DECISION_MAKERS  = "decision_makers";
    public static final String CONTACTS         = "contacts";
    public static final String CONFIDENCE       = "confidence_score";
    public static final String LEAD_STATUS      = "lead_status";
    public static final String NEXT_ACTION      = "recommended_action";
    public static final String LAST_OUTCOME     = "last_outcome";
    public static final String LAST_FAILURE     = "last_failure";

    private FactExtractor() {}

    public static List<LongTermFact> fromExecution(Execution execution, Instant now) {
        String runId = execution.getId();
        Map<String, JsonNode> data = execution.completedData();
        List<LongTermFact> facts = new ArrayList<>();

        JsonNode discovery = data.get("discovery");
        if (discovery != null) {
            ArrayNode aliases = JsonNodeFactory.instance.arrayNode();
            aliases.add(execution.getEntity());
            String official = text(discovery, "name");
            if (official != null && !official.equalsIgnoreCase(execution.getEntity())) {
                aliases.add(official);
            }
            facts.add(LongTermFact.collection(ALIASES, aliases, 5, now, runId));
            point(facts, discovery, "industry", INDUSTRY, 6, now, runId);
            point(facts, discovery, "size", SIZE, 6, now, runId);
            point(facts, discovery, "location", LOCATION, 4, now, runId);
            point(facts, discovery, "website", WEBSITE, 4, now, runId);
            point(facts, discovery, "status", DISCOVERY_STATUS, 7, now, runId);
        }

        JsonNode roles = data.get("roles");
        if (roles != null) {
            ArrayNode people = JsonNodeFactory.instance.arrayNode();
            for (JsonNode p : roles.path("people")) {
                if ("accepted".equals(p.path("status").asText()) && p.hasNonNull("name")) {
                    people.add(p.path("name").asText() + " - " + p.path("title").asText("Unknown"));
                }
            }
            if (!people.isEmpty()) {
                facts.add(LongTermFact.collection(DECISION_MAKERS, people, 7, now, runId));
            }
        }

        JsonNode enrichment = data.get("enrichment");
        if (enrichment != null) {
            ArrayNode contacts = JsonNodeFactory.instance.arrayNode();
            for (JsonNode c : enrichment.path("contacts")) {
                String name = (c.path("first_name").asText("") + " " + c.path("last_name").asText("")).strip();
                String email = c.path("email").asText("");
                if (!email.isBlank()) {
                    contacts.add(name.isEmpty() ? email : name + " <" + email + ">");
                }
            }
            if (!contacts.isEmpty()) {
                facts.add(LongTermFact.collection(CONTACTS, contacts, 8, now, runId));
            }
        }

        JsonNode verification = data.get("verification");
        if (verification != null) {
            JsonNode score = verification.path("confidence_score");
            if (score.isNumber()) {
                facts.add(LongTermFact.point(CONFIDENCE, score, 9, now, runId));
            }
            point(facts, verification, "status", LEAD_STATUS, 9, now, runId);
            point(facts, verification, "recommended_action", NEXT_ACTION, 5, now, runId);
        }

        facts.add(LongTermFact.point(LAST_OUTCOME, TextNode.valueOf(execution.getStatus().wireName()),
                6, now, runId));
        if (execution.getStatus() == ExecutionStatus.FAILED && execution.getError() != null) {
            facts.add(LongTermFact.point(LAST_FAILURE, TextNode.valueOf(execution.getError()), 7, now, runId));
        }
        return facts;
    }

    private static void point(List<LongTermFact> facts, JsonNode source, String field, String key,
                              int importance, Instant now, String runId) {
        String value = text(source, field);
        if (value != null) {
            facts.add(LongTermFact.point(key, TextNode.valueOf(value), importance, now, runId));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (!v.isValueNode() || v.isNull() || v.asText().isBlank()) {
            return null;
        }
        return v.asText();
    }
}
