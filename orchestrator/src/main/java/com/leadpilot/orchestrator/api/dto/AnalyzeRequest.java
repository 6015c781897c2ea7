package com.leadpilot.orchestrator.api.dto;

/**
 * Request body for POST /executions.
 *
 * input uses the command format: "Acme" or "Acme, Roles: CTO, VP Sales".
 */
public record AnalyzeRequest(String input) {}
