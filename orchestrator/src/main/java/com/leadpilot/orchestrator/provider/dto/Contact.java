package com.leadpilot.orchestrator.provider.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One enriched person, as stored in stage data.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Contact(
        String first_name,
        String last_name,
        String email,
        String phone,
        String linkedin_url,
        String title,
        String company,
        String source
) {
    public String fullName() {
        return ((first_name == null ? "" : first_name) + " " + (last_name == null ? "" : last_name)).strip();
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
