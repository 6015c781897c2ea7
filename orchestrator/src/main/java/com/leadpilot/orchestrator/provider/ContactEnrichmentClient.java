package com.leadpilot.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpilot.orchestrator.provider.dto.Contact;
import com.leadpilot.orchestrator.provider.dto.TopPeopleRequest;
import com.leadpilot.orchestrator.provider.dto.TopPeopleResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP client for the Apollo people API.
 *
 * Only the organization_top_people endpoint is used: given a company name it
 * returns the most senior people Apollo knows about, with whatever contact
 * details the account tier exposes.
 */
@Component
public class ContactEnrichmentClient {

    private static final Logger log = LoggerFactory.getLogger(ContactEnrichmentClient.class);

    public static final String SOURCE = "apollo";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;

    public ContactEnrichmentClient(
            @Value("${apollo.base-url:https://api.apollo.io/v1}") String baseUrl,
            @Value("${apollo.api-key:}") String apiKey,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.apiKey  = apiKey;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Top people at a company.
     *
     * @throws ProviderException if the provider is not configured, returns a
     *                           non-2xx status or cannot be reached
     */
    public List<Contact> topPeople(String companyName, int limit) {
        if (!isConfigured()) {
            throw new ProviderException(401, "apollo.api-key is not configured");
        }
        log.info("Looking up top people at '{}' (limit {})", companyName, limit);
        String body = toJson(new TopPeopleRequest(companyName, limit, 1));
        String respBody = post("/mixed_people/organization_top_people", body, "topPeople for " + companyName);
        try {
            TopPeopleResponse resp = json.readValue(respBody, TopPeopleResponse.class);
            if (resp.people() == null) {
                return List.of();
            }
            return resp.people().stream()
                    .map(p -> new Contact(
                            nullToEmpty(p.first_name()),
                            nullToEmpty(p.last_name()),
                            nullToEmpty(p.email()),
                            firstPhone(p.phone_numbers()),
                            nullToEmpty(p.linkedin_url()),
                            nullToEmpty(p.title()),
                            companyName,
                            SOURCE))
                    .toList();
        } catch (JsonProcessingException e) {
            throw new ProviderException(200, "Failed to parse topPeople response: " + e.getOriginalMessage());
        }
    }

    /**
     * One named person at a company, matched against the company's top people
     * by case-insensitive name containment in either direction.
     */
    public Optional<Contact> findPerson(String fullName, String companyName) {
        String wanted = fullName.strip().toLowerCase(Locale.ROOT);
        return topPeople(companyName, 20).stream()
                .filter(c -> !c.fullName().isEmpty())
                .filter(c -> {
                    String have = c.fullName().toLowerCase(Locale.ROOT);
                    return have.contains(wanted) || wanted.contains(have);
                })
                .findFirst();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type",  "application/json")
                    .header("Cache-Control", "no-cache")
                    .header("X-Api-Key",     apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ProviderException(resp.statusCode(),
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(opName + " interrupted", e);
        } catch (IOException e) {
            throw new ProviderException(opName + " failed: " + e.getMessage(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProviderException(0, "JSON serialization failed: " + e.getOriginalMessage());
        }
    }

    private static String firstPhone(List<TopPeopleResponse.PhoneNumber> phones) {
        if (phones == null || phones.isEmpty()) {
            return "";
        }
        TopPeopleResponse.PhoneNumber p = phones.get(0);
        return p.sanitized_number() != null && !p.sanitized_number().isBlank()
                ? p.sanitized_number() : nullToEmpty(p.raw_number());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
