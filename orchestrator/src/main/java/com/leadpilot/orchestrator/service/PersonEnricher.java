package com.leadpilot.orchestrator.service;

import com.leadpilot.orchestrator.provider.ContactEnrichmentClient;
import com.leadpilot.orchestrator.provider.EmailFinderClient;
import com.leadpilot.orchestrator.provider.ProviderException;
import com.leadpilot.orchestrator.provider.dto.Contact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contact lookup for one named person, outside any pipeline run.
 *
 * Apollo is asked first. When it has no address, Snov.io is asked with a
 * domain guessed from the company name. Nothing is checkpointed.
 */
@Service
public class PersonEnricher {

    private static final Logger log = LoggerFactory.getLogger(PersonEnricher.class);

    static final String NOT_FOUND      = "Person not found in Apollo or Snov.io";
    static final String NOT_CONFIGURED = "No contact provider configured";

    private final ContactEnrichmentClient apollo;
    private final EmailFinderClient       snov;

    public PersonEnricher(ContactEnrichmentClient apollo, EmailFinderClient snov) {
        this.apollo = apollo;
        this.snov   = snov;
    }

    /**
     * @throws IllegalArgumentException if the name or company is blank
     */
    public PersonLookup enrich(String fullName, String company) {
        if (fullName == null || fullName.isBlank() || company == null || company.isBlank()) {
            throw new IllegalArgumentException("Both a name and a company are required");
        }
        String name = fullName.strip();
        String org  = company.strip();

        List<String> configured = new ArrayList<>();
        if (apollo.isConfigured()) {
            configured.add(ContactEnrichmentClient.SOURCE);
        }
        if (snov.isConfigured()) {
            configured.add(EmailFinderClient.SOURCE);
        }
        if (configured.isEmpty()) {
            return new PersonLookup(name, org, null, NOT_CONFIGURED, configured);
        }

        Contact match = null;
        if (apollo.isConfigured()) {
            try {
                match = apollo.findPerson(name, org).orElse(null);
            } catch (ProviderException e) {
                log.warn("Apollo lookup for '{}' at '{}' failed: {}", name, org, e.getMessage());
            }
            if (match != null && match.hasEmail()) {
                return new PersonLookup(name, org, match, null, configured);
            }
        }

        if (snov.isConfigured()) {
            String[] parts = name.split("\\s+", 2);
            String first = parts[0];
            String last  = parts.length > 1 ? parts[1] : "";
            try {
                Optional<String> email = snov.findEmail(EmailFinderClient.guessDomain(org), first, last);
                if (email.isPresent()) {
                    Contact found = match == null
                            ? new Contact(first, last, email.get(), "", "", "", org, EmailFinderClient.SOURCE)
                            : new Contact(match.first_name(), match.last_name(), email.get(), match.phone(),
                                    match.linkedin_url(), match.title(), org,
                                    match.source() + "+" + EmailFinderClient.SOURCE);
                    return new PersonLookup(name, org, found, null, configured);
                }
            } catch (ProviderException e) {
                log.warn("Snov.io lookup for '{}' at '{}' failed: {}", name, org, e.getMessage());
            }
        }

        if (match != null) {
            return new PersonLookup(name, org, match, null, configured);
        }
        return new PersonLookup(name, org, null, NOT_FOUND, configured);
    }
}
