package com.leadpilot.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpilot.orchestrator.provider.dto.EmailFinderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP client for the Snov.io email finder, the fallback when Apollo has no
 * address for a person.
 *
 * Snov authenticates with an OAuth client-credentials token that lives for an
 * hour; it is cached and refreshed {@link #TOKEN_TTL} after issue.
 */
@Component
public class EmailFinderClient {

    private static final Logger log = LoggerFactory.getLogger(EmailFinderClient.class);

    public static final String SOURCE = "snov";

    static final Duration TOKEN_TTL = Duration.ofSeconds(3300);

    private static final Set<String> COMPANY_SUFFIXES = Set.of(
            "corporation", "corp", "incorporated", "inc", "limited", "ltd", "llc", "llp", "plc",
            "company", "co", "group", "holdings", "technologies", "technology", "tech",
            "solutions", "services", "systems", "international", "intl", "global");

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Clock        clock;
    private final String       baseUrl;
    private final String       clientId;
    private final String       clientSecret;

    private String  token;
    private Instant tokenExpires = Instant.EPOCH;

    public EmailFinderClient(
            @Value("${snov.base-url:https://api.snov.io/v1}") String baseUrl,
            @Value("${snov.client-id:}") String clientId,
            @Value("${snov.client-secret:}") String clientSecret,
            ObjectMapper objectMapper,
            Clock clock) {
        this.baseUrl      = baseUrl;
        this.clientId     = clientId;
        this.clientSecret = clientSecret;
        this.json         = objectMapper;
        this.clock        = clock;
        this.http         = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }

    /**
     * The most likely address for a person at a domain, if Snov knows one.
     *
     * @throws ProviderException if the provider is not configured, returns a
     *                           non-2xx status or cannot be reached
     */
    public Optional<String> findEmail(String domain, String firstName, String lastName) {
        if (!isConfigured()) {
            throw new ProviderException(401, "snov.client-id / snov.client-secret are not configured");
        }
        log.info("Looking up email for '{} {}' at {}", firstName, lastName, domain);
        String body = toJson(Map.of("firstName", firstName, "lastName", lastName, "domain", domain));
        String resp = post("/get-emails-from-names", body, accessToken(), "findEmail at " + domain);
        return parseEmail(resp);
    }

    /**
     * Best-effort domain for a company name: legal and industry suffixes
     * dropped, punctuation removed, ".com" appended.
     */
    public static String guessDomain(String company) {
        List<String> words = Arrays.stream(company.toLowerCase(Locale.ROOT).strip().split("\\s+"))
                .map(w -> w.replaceAll("[,.']", ""))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
        while (words.size() > 1 && COMPANY_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join("", words).replace("-", "") + ".com";
    }

    Optional<String> parseEmail(String body) {
        try {
            EmailFinderResponse.Emails resp = json.readValue(body, EmailFinderResponse.Emails.class);
            if (!resp.success() || resp.data() == null || resp.data().emails() == null) {
                return Optional.empty();
            }
            return resp.data().emails().stream()
                    .map(EmailFinderResponse.Email::email)
                    .filter(e -> e != null && !e.isBlank())
                    .findFirst();
        } catch (JsonProcessingException e) {
            throw new ProviderException(200, "Failed to parse email finder response: " + e.getOriginalMessage());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private synchronized String accessToken() {
        Instant now = clock.instant();
        if (token != null && now.isBefore(tokenExpires)) {
            return token;
        }
        String body = toJson(Map.of(
                "grant_type",    "client_credentials",
                "client_id",     clientId,
                "client_secret", clientSecret));
        String resp = post("/oauth/access_token", body, null, "oauth token");
        try {
            EmailFinderResponse.Token t = json.readValue(resp, EmailFinderResponse.Token.class);
            if (t.access_token() == null || t.access_token().isBlank()) {
                throw new ProviderException(401, "Snov.io returned no access token");
            }
            token        = t.access_token();
            tokenExpires = now.plus(TOKEN_TTL);
            return token;
        } catch (JsonProcessingException e) {
            throw new ProviderException(200, "Failed to parse token response: " + e.getOriginalMessage());
        }
    }

    private String post(String path, String jsonBody, String bearer, String opName) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
            if (bearer != null) {
                req.header("Authorization", "Bearer " + bearer);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
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
}
