package com.leadpilot.orchestrator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The parts of the Snov.io token and get-emails-from-names responses we read.
 */
public final class EmailFinderResponse {

    private EmailFinderResponse() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Token(String access_token, Long expires_in) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Emails(boolean success, Data data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(List<Email> emails) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Email(String email, String emailStatus) {}
}
