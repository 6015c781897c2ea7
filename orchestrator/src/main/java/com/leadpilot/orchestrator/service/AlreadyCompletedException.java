package com.leadpilot.orchestrator.service;

/**
 * Thrown when resuming an execution that already completed. Completed executions are read-only.
 */
public class AlreadyCompletedException extends RuntimeException {

    private final String executionId;

    public AlreadyCompletedException(String executionId) {
        super("Execution " + executionId + " is already completed");
        this.executionId = executionId;
    }

    public String getExecutionId() { return executionId; }
}
