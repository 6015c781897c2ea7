package com.leadpilot.orchestrator.provider.dto;

/**
 * One organic or news hit from the web search provider.
 */
public record SearchResult(String title, String snippet, String url) {

    public SearchResult {
        title   = title == null ? "" : title;
        snippet = snippet == null ? "" : snippet;
        url     = url == null ? "" : url;
    }
}
