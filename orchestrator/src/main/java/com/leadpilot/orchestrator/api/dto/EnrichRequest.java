package com.leadpilot.orchestrator.api.dto;

/**
 * Request body for POST /contacts/enrich.
 */
public record EnrichRequest(String name, String company) {}
