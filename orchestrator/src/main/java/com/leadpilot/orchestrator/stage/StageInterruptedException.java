package com.leadpilot.orchestrator.stage;

/**
 * Thrown from inside a stage when it observes a stop request.
 *
 * Not a failure: the orchestrator leaves the stage exactly as last checkpointed
 * (RUNNING, with or without partial data) and pauses the execution.
 */
public class StageInterruptedException extends RuntimeException {

    private final String stage;

    public StageInterruptedException(String stage) {
        super("Stage '" + stage + "' interrupted by stop request");
        this.stage = stage;
    }

    public String getStage() { return stage; }
}
