package com.leadpilot.orchestrator.stage;

/**
 * What the orchestrator does when a stage ends in a StageFailure.
 */
public enum StagePolicy {
    /** Record the failure and fail the whole execution. */
    ABORT,
    /** Record the failure and continue with degraded data (a fallback exists downstream). */
    CONTINUE
}
