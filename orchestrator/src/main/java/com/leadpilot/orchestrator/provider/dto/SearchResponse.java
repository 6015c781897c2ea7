package com.leadpilot.orchestrator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The part of a SerpApi search response we read. Web searches fill
 * organic_results, news searches (tbm=nws) fill news_results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(List<Hit> organic_results, List<Hit> news_results, String error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hit(String title, String link, String snippet) {

        public SearchResult toResult() {
            return new SearchResult(title, snippet, link);
        }
    }
}
