package com.leadpilot.orchestrator.provider;

import com.leadpilot.orchestrator.provider.dto.NetworkProfile;
import com.leadpilot.orchestrator.provider.dto.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds decision-makers by searching public LinkedIn profiles.
 *
 * There is no LinkedIn API involved: profiles are found with site-restricted
 * web searches and the name and title are read from the result title
 * ("Jane Doe - VP Engineering - Acme | LinkedIn").
 */
@Component
public class ProfessionalNetworkClient {

    private static final Logger log = LoggerFactory.getLogger(ProfessionalNetworkClient.class);

    static final int TITLES_PER_SEARCH  = 3;
    static final int RESULTS_PER_TITLE  = 3;

    private static final Pattern NAME_JUNK = Pattern.compile("[^\\w\\s.\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TITLE_IN_TEXT = Pattern.compile(
            "(CEO|CTO|CFO|COO|CMO|VP|Director|Manager|Head of|Chief|President|Founder)",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, List<String>> TITLES_BY_SIZE = Map.of(
            "small",      List.of("Founder", "CEO", "CTO", "Owner", "Managing Director"),
            "medium",     List.of("CEO", "CTO", "VP", "Director", "Head of"),
            "large",      List.of("VP", "SVP", "Director", "Senior Director", "Head of"),
            "enterprise", List.of("SVP", "EVP", "VP", "Senior Director", "Global Head"));

    private final WebSearchClient search;

    public ProfessionalNetworkClient(WebSearchClient search) {
        this.search = search;
    }

    public boolean isConfigured() {
        return search.isConfigured();
    }

    /**
     * Profiles matching the senior titles typical for a company of this size,
     * de-duplicated by name.
     *
     * @throws ProviderException if a search fails
     */
    public List<NetworkProfile> decisionMakers(String company, String size) {
        Map<String, NetworkProfile> byName = new LinkedHashMap<>();
        for (String title : titlesFor(size).subList(0, TITLES_PER_SEARCH)) {
            String query = "site:linkedin.com/in \"%s\" \"%s\"".formatted(company, title);
            for (SearchResult r : search.search(query, RESULTS_PER_TITLE)) {
                parse(r, company, title)
                        .ifPresent(p -> byName.putIfAbsent(p.name().toLowerCase(Locale.ROOT), p));
            }
        }
        log.info("Found {} LinkedIn profiles for '{}'", byName.size(), company);
        return new ArrayList<>(byName.values());
    }

    static List<String> titlesFor(String size) {
        String key = size == null ? "" : size.strip().toLowerCase(Locale.ROOT);
        return TITLES_BY_SIZE.getOrDefault(key, TITLES_BY_SIZE.get("medium"));
    }

    /** Reads a profile from one search hit; empty unless it is a person's profile page. */
    static Optional<NetworkProfile> parse(SearchResult hit, String company, String searchedTitle) {
        if (!hit.url().contains("/in/")) {
            return Optional.empty();
        }
        String raw = hit.title();
        String name;
        String title = "";
        if (raw.contains(" - ")) {
            String[] parts = raw.split(" - ");
            name = parts[0];
            if (parts.length > 1) {
                title = parts[1];
            }
        } else {
            name = raw.split(" \\| ")[0];
        }
        name = NAME_JUNK.matcher(name).replaceAll("").strip();
        if (name.length() < 2 || "linkedin".equalsIgnoreCase(name)) {
            return Optional.empty();
        }
        title = title.replace("| LinkedIn", "").strip();
        if (title.isEmpty()) {
            Matcher m = TITLE_IN_TEXT.matcher(hit.snippet());
            if (m.find()) {
                title = m.group(1);
            }
        }
        return Optional.of(new NetworkProfile(name, title, company, hit.url(), searchedTitle));
    }
}
