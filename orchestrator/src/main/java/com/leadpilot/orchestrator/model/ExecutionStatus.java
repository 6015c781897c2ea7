package com.leadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * States of one pipeline Execution.
 *
 * Transitions:
 *   PENDING → RUNNING                (activated by the orchestrator)
 *   RUNNING → PAUSED                 (stop signal, shutdown)
 *   PAUSED / FAILED / RUNNING → RUNNING  (resume)
 *   RUNNING → COMPLETED | FAILED     (natural end)
 *
 * COMPLETED is terminal: the execution is archived and can never be resumed.
 * A RUNNING status found on disk at startup means the process died mid-run.
 */
public enum ExecutionStatus {
    @JsonProperty("pending")   PENDING,
    @JsonProperty("running")   RUNNING,
    @JsonProperty("paused")    PAUSED,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed")    FAILED;

    public boolean isResumable() {
        return this == PAUSED || this == FAILED || this == RUNNING;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
