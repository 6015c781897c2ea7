package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.provider.ContactEnrichmentClient;
import com.leadpilot.orchestrator.provider.EmailFinderClient;
import com.leadpilot.orchestrator.provider.ProviderException;
import com.leadpilot.orchestrator.provider.dto.Contact;
import com.leadpilot.orchestrator.stage.Stage;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageDefinition;
import com.leadpilot.orchestrator.stage.StagePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stage 4: fetch contact details for the accepted decision-makers.
 *
 * Apollo supplies the people it knows at the company. Snov.io then fills in
 * missing addresses and looks up accepted people Apollo did not return.
 * Either provider may be unconfigured; the gap is reported in {@code errors}.
 *
 * The provider responses are checkpointed as a partial result before
 * post-processing, so a stop that arrives afterwards does not cost a second
 * provider call on resume.
 */
@Component
public class EnrichmentStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);

    public static final String NAME = "enrichment";

    private static final StageDefinition DEFINITION = new StageDefinition(
            NAME, 4, "Fetch contact details for accepted decision-makers", StagePolicy.CONTINUE);

    static final String APOLLO_NOT_CONFIGURED = "Apollo API not configured";
    static final String SNOV_NOT_CONFIGURED   = "Snov.io API not configured";

    private final ContactEnrichmentClient provider;
    private final EmailFinderClient       finder;
    private final ObjectMapper            json;

    public EnrichmentStage(ContactEnrichmentClient provider, EmailFinderClient finder, ObjectMapper json) {
        this.provider = provider;
        this.finder   = finder;
        this.json     = json;
    }

    @Override
    public StageDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode execute(StageContext ctx) {
        JsonNode roles = ctx.priorResult(RoleSearchStage.NAME);
        String company = roles.path("company").asText(ctx.request().company());

        List<JsonNode> accepted = new ArrayList<>();
        for (JsonNode p : roles.path("people")) {
            if ("accepted".equals(p.path("status").asText())) {
                accepted.add(p);
            }
        }

        ObjectNode result = json.createObjectNode();
        ArrayNode contactsNode = result.putArray("contacts");
        if (accepted.isEmpty()) {
            result.put("note", "No accepted roles to enrich");
            ctx.note("warning", json.createObjectNode().put("summary", "No accepted roles to enrich at " + company), 7);
            return result;
        }

        ArrayNode errors = result.putArray("errors");
        if (!provider.isConfigured()) {
            errors.add(APOLLO_NOT_CONFIGURED);
        }
        if (!finder.isConfigured()) {
            errors.add(SNOV_NOT_CONFIGURED);
        }
        if (!provider.isConfigured() && !finder.isConfigured()) {
            result.put("note", "No matching contacts found");
            return result;
        }

        ctx.checkCancelled();
        Set<String> sources = new LinkedHashSet<>();
        List<Contact> found = new ArrayList<>();
        if (provider.isConfigured()) {
            try {
                found.addAll(provider.topPeople(company, 10));
                sources.add(ContactEnrichmentClient.SOURCE);
            } catch (ProviderException e) {
                if (e.isTransient()) {
                    throw e;
                }
                log.warn("Apollo lookup failed for '{}': {}", company, e.getMessage());
                errors.add("Apollo lookup failed: " + e.getMessage());
            }
        }
        if (finder.isConfigured()) {
            String domain = domainFor(ctx.priorResult(DiscoveryStage.NAME), company);
            try {
                found = findMissingEmails(ctx, found, accepted, company, domain, sources);
            } catch (ProviderException e) {
                if (e.isTransient()) {
                    throw e;
                }
                log.warn("Email finder failed for '{}': {}", domain, e.getMessage());
                errors.add("Snov.io lookup failed: " + e.getMessage());
            }
        }

        List<Contact> contacts = dedupe(found);
        contacts.forEach(c -> contactsNode.add(json.valueToTree(c)));
        sources.forEach(result.putArray("sources_used")::add);
        result.put("total_found", contacts.size());
        ctx.commitPartial(result.deepCopy());
        log.debug("Committed {} contacts for '{}' as partial result", contacts.size(), company);

        ctx.checkCancelled();
        Contact primary = null;
        int bestPower = 0;
        for (Contact c : contacts) {
            int power = DecisionPower.score(c.title());
            if (c.hasEmail() && power > bestPower) {
                primary = c;
                bestPower = power;
            }
        }
        if (primary != null) {
            result.set("primary_contact", json.valueToTree(primary));
        }
        long withEmail = contacts.stream().filter(Contact::hasEmail).count();
        result.put("with_email", withEmail);
        if (contacts.isEmpty()) {
            result.put("note", "No matching contacts found");
        }
        ctx.note("enrichment", json.createObjectNode()
                .put("summary", "%d contacts (%d with email) at %s".formatted(contacts.size(), withEmail, company)),
                withEmail > 0 ? 8 : 6);
        return result;
    }

    /**
     * Fills in addresses the contact provider did not have, then looks up the
     * accepted people it did not return at all.
     */
    private List<Contact> findMissingEmails(StageContext ctx, List<Contact> found, List<JsonNode> accepted,
                                            String company, String domain, Set<String> sources) {
        List<Contact> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Contact c : found) {
            names.add(c.fullName().toLowerCase(Locale.ROOT));
            if (c.hasEmail() || c.first_name() == null || c.first_name().isBlank()) {
                out.add(c);
                continue;
            }
            ctx.checkCancelled();
            Optional<String> email = finder.findEmail(domain, c.first_name(), nullToEmpty(c.last_name()));
            if (email.isPresent()) {
                sources.add(EmailFinderClient.SOURCE);
                out.add(new Contact(c.first_name(), c.last_name(), email.get(), c.phone(), c.linkedin_url(),
                        c.title(), c.company(), c.source() + "+" + EmailFinderClient.SOURCE));
            } else {
                out.add(c);
            }
        }

        for (JsonNode person : accepted) {
            String name = person.path("name").asText("").strip();
            if (name.isEmpty() || name.startsWith("[") || names.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            String[] parts = name.split("\\s+", 2);
            ctx.checkCancelled();
            Optional<String> email = finder.findEmail(domain, parts[0], parts.length > 1 ? parts[1] : "");
            if (email.isPresent()) {
                sources.add(EmailFinderClient.SOURCE);
                out.add(new Contact(parts[0], parts.length > 1 ? parts[1] : "", email.get(), "",
                        person.path("linkedin_url").asText(""), person.path("title").asText(""),
                        company, EmailFinderClient.SOURCE));
            }
        }
        return out;
    }

    /** The website discovery reported, bare, or a guess from the company name. */
    static String domainFor(JsonNode discovery, String company) {
        String site = discovery.path("website").asText("").strip().toLowerCase(Locale.ROOT);
        site = site.replaceFirst("^https?://", "").replaceFirst("^www\\.", "");
        int slash = site.indexOf('/');
        if (slash >= 0) {
            site = site.substring(0, slash);
        }
        return site.contains(".") ? site : EmailFinderClient.guessDomain(company);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    /** First occurrence wins; identity is the email, or the lower-cased full name when there is none. */
    static List<Contact> dedupe(List<Contact> contacts) {
        Map<String, Contact> byKey = new LinkedHashMap<>();
        for (Contact c : contacts) {
            if (c.first_name() == null || c.first_name().isBlank()) {
                continue;
            }
            String key = c.hasEmail() ? c.email().toLowerCase(Locale.ROOT) : c.fullName().toLowerCase(Locale.ROOT);
            byKey.putIfAbsent(key, c);
        }
        return new ArrayList<>(byKey.values());
    }
}
