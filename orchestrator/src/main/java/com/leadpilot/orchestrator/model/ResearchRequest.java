package com.leadpilot.orchestrator.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parsed form of an operator's free-text request.
 *
 * Accepted formats:
 *   "Acme"
 *   "Company: Acme"
 *   "Acme, Roles: CEO, VP Sales"
 *
 * entityKey is the case-normalized name used to key long-term memory.
 */
public record ResearchRequest(String company, List<String> roles) {

    public static ResearchRequest parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must name a company");
        }
        String text = input.strip();
        String companyPart = text;
        List<String> roles = List.of();

        int idx = text.toLowerCase(Locale.ROOT).indexOf("roles:");
        if (idx >= 0) {
            companyPart = text.substring(0, idx);
            String rolesPart = text.substring(idx + "roles:".length());
            roles = Arrays.stream(rolesPart.split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        String company = companyPart.strip();
        if (company.toLowerCase(Locale.ROOT).startsWith("company:")) {
            company = company.substring("company:".length()).strip();
        }
        while (company.endsWith(",")) {
            company = company.substring(0, company.length() - 1).strip();
        }
        if (company.isEmpty()) {
            throw new IllegalArgumentException("Input must name a company: '" + input + "'");
        }
        return new ResearchRequest(company, roles);
    }

    public String entityKey() {
        return normalize(company);
    }

    public static String normalize(String entity) {
        return entity == null ? "" : entity.strip().toLowerCase(Locale.ROOT);
    }
}
