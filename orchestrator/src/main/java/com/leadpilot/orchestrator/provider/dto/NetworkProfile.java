package com.leadpilot.orchestrator.provider.dto;

/**
 * A person found through a professional-network profile search.
 *
 * @param searchedTitle the title query that surfaced this profile
 */
public record NetworkProfile(
        String name,
        String title,
        String company,
        String profileUrl,
        String searchedTitle
) {}
