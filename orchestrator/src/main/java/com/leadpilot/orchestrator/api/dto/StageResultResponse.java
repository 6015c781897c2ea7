package com.leadpilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.leadpilot.orchestrator.model.StageResult;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResultResponse(
        String   status,
        JsonNode data,
        String   error,
        int      attempts,
        Instant  startedAt,
        Instant  finishedAt
) {
    public static StageResultResponse from(StageResult r) {
        return new StageResultResponse(
                r.getStatus().wireName(),
                r.getData(),
                r.getError(),
                r.getAttempts(),
                r.getStartedAt(),
                r.getFinishedAt()
        );
    }
}
