package com.leadpilot.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Progress event pushed to the operator surface.
 *
 * <pre>
 *   {event: progress|log|result|error, executionId, stage?, status?, data?, error?, message?, timestamp}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineEvent(
        EventType event,
        String    executionId,
        String    stage,
        String    status,
        JsonNode  data,
        String    error,
        String    message,
        Instant   timestamp) {

    public static PipelineEvent progress(String executionId, String stage, String status,
                                         JsonNode data, Instant at) {
        return new PipelineEvent(EventType.PROGRESS, executionId, stage, status, data, null, null, at);
    }

    public static PipelineEvent stageFailed(String executionId, String stage, String error, Instant at) {
        return new PipelineEvent(EventType.PROGRESS, executionId, stage, "failed", null, error, null, at);
    }

    public static PipelineEvent paused(String executionId, String stage, String reason, Instant at) {
        return new PipelineEvent(EventType.PROGRESS, executionId, stage, "paused", null, null, reason, at);
    }

    public static PipelineEvent log(String executionId, String stage, String message,
                                    JsonNode data, Instant at) {
        return new PipelineEvent(EventType.LOG, executionId, stage, null, data, null, message, at);
    }

    public static PipelineEvent result(String executionId, JsonNode data, Instant at) {
        return new PipelineEvent(EventType.RESULT, executionId, null, "completed", data, null, null, at);
    }

    public static PipelineEvent error(String executionId, String stage, String error, Instant at) {
        return new PipelineEvent(EventType.ERROR, executionId, stage, null, null, error, null, at);
    }
}
