package com.leadpilot.orchestrator.api.dto;

import com.leadpilot.orchestrator.model.Execution;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body for GET /executions/{id}: the full checkpoint, stages in pipeline order.
 */
public record ExecutionResponse(
        String                           id,
        String                           input,
        String                           entity,
        String                           status,
        String                           error,
        Instant                          createdAt,
        Instant                          updatedAt,
        Instant                          completedAt,
        Map<String, StageResultResponse> stages
) {
    public static ExecutionResponse from(Execution e) {
        Map<String, StageResultResponse> stages = new LinkedHashMap<>();
        e.getStageResults().forEach((name, r) -> stages.put(name, StageResultResponse.from(r)));
        return new ExecutionResponse(
                e.getId(),
                e.getInput(),
                e.getEntity(),
                e.getStatus().wireName(),
                e.getError(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.getCompletedAt(),
                stages
        );
    }
}
