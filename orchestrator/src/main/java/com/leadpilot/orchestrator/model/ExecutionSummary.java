package com.leadpilot.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the history / resumable listing.
 *
 * resumeStage is the first stage that is not settled, or null when every
 * touched stage is settled.
 */
public record ExecutionSummary(
        String          id,
        String          entity,
        ExecutionStatus status,
        String          resumeStage,
        int             completedStages,
        String          error,
        Instant         createdAt,
        Instant         updatedAt
) {
    public static ExecutionSummary from(Execution e) {
        String resumeStage = e.getStageResults().entrySet().stream()
                .filter(en -> !en.getValue().getStatus().isSettled())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
        int completed = (int) e.getStageResults().values().stream()
                .filter(r -> r.getStatus() == StageStatus.COMPLETED)
                .count();
        return new ExecutionSummary(e.getId(), e.getEntity(), e.getStatus(), resumeStage,
                completed, e.getError(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
