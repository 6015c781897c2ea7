package com.leadpilot.orchestrator.memory;

/**
 * Outcome of one stage attempt, fed into the pattern tier.
 *
 * @param sizeHint company size as reported by discovery in this run, may be null
 */
public record StageOutcome(boolean success, long latencyMillis, String sizeHint) {

    public static StageOutcome success(long latencyMillis, String sizeHint) {
        return new StageOutcome(true, latencyMillis, sizeHint);
    }

    public static StageOutcome failure(long latencyMillis, String sizeHint) {
        return new StageOutcome(false, latencyMillis, sizeHint);
    }
}
