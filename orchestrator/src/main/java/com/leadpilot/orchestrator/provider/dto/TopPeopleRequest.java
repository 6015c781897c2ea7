package com.leadpilot.orchestrator.provider.dto;

/**
 * Body of POST /v1/mixed_people/organization_top_people.
 */
public record TopPeopleRequest(
        String organization_name,
        int per_page,
        int page
) {}
