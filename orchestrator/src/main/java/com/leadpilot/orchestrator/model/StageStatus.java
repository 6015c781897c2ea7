package com.leadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution state of a single stage inside an Execution.
 *
 * Transitions:
 *   PENDING → RUNNING    (checkpointed before the stage function is invoked)
 *   RUNNING → COMPLETED  (stage returned data)
 *   RUNNING → FAILED     (stage raised a StageFailure)
 *   PENDING → SKIPPED    (an earlier stage ended the pipeline)
 *
 * A stage left RUNNING on disk was interrupted. It may still carry partial data.
 */
public enum StageStatus {
    @JsonProperty("pending")   PENDING,
    @JsonProperty("running")   RUNNING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed")    FAILED,
    @JsonProperty("skipped")   SKIPPED;

    /** True when the resume logic must not re-run the stage. */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
