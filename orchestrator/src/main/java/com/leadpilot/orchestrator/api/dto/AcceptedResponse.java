package com.leadpilot.orchestrator.api.dto;

/**
 * Body of 202 responses: the command was accepted and runs in the background.
 * Follow progress on GET /events or by polling GET /executions/{id}.
 */
public record AcceptedResponse(String executionId, String message) {}
