package com.leadpilot.orchestrator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The part of the organization_top_people response we read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopPeopleResponse(List<Person> people) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Person(
            String first_name,
            String last_name,
            String email,
            String title,
            String linkedin_url,
            List<PhoneNumber> phone_numbers
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PhoneNumber(String sanitized_number, String raw_number) {}
}
