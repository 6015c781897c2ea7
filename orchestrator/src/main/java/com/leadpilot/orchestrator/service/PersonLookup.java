package com.leadpilot.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.leadpilot.orchestrator.provider.dto.Contact;

import java.util.List;

/**
 * Outcome of a one-off contact lookup for a named person.
 *
 * @param contact    the person found, or null
 * @param error      why nothing was found, or null
 * @param configured providers that were available for the lookup
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersonLookup(
        String name,
        String company,
        Contact contact,
        String error,
        List<String> configured
) {
    public boolean found() {
        return contact != null;
    }
}
