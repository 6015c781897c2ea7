package com.leadpilot.orchestrator.api.dto;

import com.leadpilot.orchestrator.memory.RecalledFact;

import java.util.List;

/**
 * Response body for GET /memory/{entity}: the recalled facts, most relevant first.
 */
public record MemoryResponse(
        String             entityKey,
        String             displayName,
        int                timesAnalyzed,
        List<RecalledFact> facts
) {}
