package com.leadpilot.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpilot.orchestrator.provider.dto.CompanyResearch;
import com.leadpilot.orchestrator.provider.dto.SearchResponse;
import com.leadpilot.orchestrator.provider.dto.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP client for SerpApi's Google search endpoint.
 *
 * Used to ground discovery in real search results and, through
 * {@link ProfessionalNetworkClient}, to find people by title.
 */
@Component
public class WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(WebSearchClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;

    public WebSearchClient(
            @Value("${serpapi.base-url:https://serpapi.com}") String baseUrl,
            @Value("${serpapi.api-key:}") String apiKey,
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
     * Organic web results for a query.
     *
     * @throws ProviderException if the provider is not configured, returns an
     *                           error or cannot be reached
     */
    public List<SearchResult> search(String query, int limit) {
        SearchResponse resp = get(Map.of("engine", "google", "q", query, "num", String.valueOf(limit)), query);
        return results(resp.organic_results(), limit);
    }

    /** News results for a query. */
    public List<SearchResult> news(String query, int limit) {
        SearchResponse resp = get(
                Map.of("engine", "google", "q", query, "tbm", "nws", "num", String.valueOf(limit)), query);
        return results(resp.news_results(), limit);
    }

    /**
     * General results, recent news and the company's professional-network page.
     * Never throws: a failed section is left empty and reported in
     * {@link CompanyResearch#errors()}.
     */
    public CompanyResearch researchCompany(String company) {
        if (!isConfigured()) {
            return CompanyResearch.none(company, "Web search not configured");
        }
        List<String> sources = new ArrayList<>();
        List<String> errors  = new ArrayList<>();

        List<SearchResult> web = List.of();
        try {
            web = search(company + " company", 3);
            if (!web.isEmpty()) {
                sources.add("web");
            }
        } catch (ProviderException e) {
            errors.add("Web search failed: " + e.getMessage());
        }

        List<SearchResult> news = List.of();
        try {
            news = news(company, 3);
            if (!news.isEmpty()) {
                sources.add("news");
            }
        } catch (ProviderException e) {
            errors.add("News search failed: " + e.getMessage());
        }

        SearchResult page = null;
        try {
            List<SearchResult> hits = search(company + " site:linkedin.com/company", 1);
            if (!hits.isEmpty()) {
                page = hits.get(0);
                sources.add("linkedin");
            }
        } catch (ProviderException e) {
            errors.add("LinkedIn page search failed: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            log.warn("Research for '{}' incomplete: {}", company, errors);
        }
        return new CompanyResearch(company, web, news, page, sources, errors);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private SearchResponse get(Map<String, String> params, String opName) {
        if (!isConfigured()) {
            throw new ProviderException(401, "serpapi.api-key is not configured");
        }
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"))
                + "&api_key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/search?" + query))
                    .timeout(Duration.ofSeconds(30))
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ProviderException(resp.statusCode(),
                        "search '" + opName + "' failed: HTTP " + resp.statusCode());
            }
            return parse(resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("search '" + opName + "' interrupted", e);
        } catch (IOException e) {
            throw new ProviderException("search '" + opName + "' failed: " + e.getMessage(), e);
        }
    }

    SearchResponse parse(String body) {
        try {
            SearchResponse resp = json.readValue(body, SearchResponse.class);
            if (resp.error() != null && resp.error().contains("hasn't returned any results")) {
                return new SearchResponse(List.of(), List.of(), null);
            }
            if (resp.error() != null && !resp.error().isBlank()) {
                throw new ProviderException(200, "SerpApi error: " + resp.error());
            }
            return resp;
        } catch (JsonProcessingException e) {
            throw new ProviderException(200, "Failed to parse search response: " + e.getOriginalMessage());
        }
    }

    private static List<SearchResult> results(List<SearchResponse.Hit> hits, int limit) {
        if (hits == null) {
            return List.of();
        }
        return hits.stream().limit(limit).map(SearchResponse.Hit::toResult).toList();
    }
}
