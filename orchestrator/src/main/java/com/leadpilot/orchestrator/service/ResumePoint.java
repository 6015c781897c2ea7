package com.leadpilot.orchestrator.service;

/**
 * Where a resumed execution continues.
 *
 * @param stage    first stage that is neither completed nor skipped; null when there is none
 * @param index    its position in the registry; equals the stage count when stage is null
 * @param recovery how the stage's saved state is treated
 */
public record ResumePoint(String stage, int index, Recovery recovery) {

    public enum Recovery {
        /** Stage never started; run it normally. */
        NONE,
        /** Stage was interrupted after checkpointing data; the data is accepted as its result. */
        RESTORED,
        /** Stage was interrupted or failed with no usable data; it is run again from scratch. */
        FRESH
    }

    public boolean isFinished() {
        return stage == null;
    }
}
