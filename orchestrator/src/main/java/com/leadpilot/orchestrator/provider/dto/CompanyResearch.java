package com.leadpilot.orchestrator.provider.dto;

import java.util.List;

/**
 * Web findings about one company, gathered before the discovery prompt.
 *
 * Each section is looked up independently; a section that failed is empty and
 * has an entry in {@code errors}.
 */
public record CompanyResearch(
        String company,
        List<SearchResult> web,
        List<SearchResult> news,
        SearchResult networkPage,
        List<String> sources,
        List<String> errors
) {
    public static CompanyResearch none(String company, String reason) {
        return new CompanyResearch(company, List.of(), List.of(), null, List.of(), List.of(reason));
    }

    public boolean isEmpty() {
        return web.isEmpty() && news.isEmpty() && networkPage == null;
    }

    /** Plain-text digest handed to the model. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Company: ").append(company).append('\n');
        sb.append("Sources checked: ").append(String.join(", ", sources)).append("\n\n");
        if (!web.isEmpty()) {
            sb.append("Web Search Results:\n");
            for (SearchResult r : web) {
                sb.append("- ").append(r.title()).append(": ").append(cut(r.snippet(), 200)).append('\n');
            }
            sb.append('\n');
        }
        if (!news.isEmpty()) {
            sb.append("Recent News:\n");
            for (SearchResult r : news) {
                sb.append("- ").append(r.title()).append(": ").append(cut(r.snippet(), 150)).append('\n');
            }
            sb.append('\n');
        }
        if (networkPage != null) {
            sb.append("LinkedIn: ").append(networkPage.url()).append('\n');
            if (!networkPage.snippet().isEmpty()) {
                sb.append(cut(networkPage.snippet(), 200)).append('\n');
            }
        }
        return sb.toString().strip();
    }

    private static String cut(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
