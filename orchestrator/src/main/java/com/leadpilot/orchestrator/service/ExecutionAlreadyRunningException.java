package com.leadpilot.orchestrator.service;

/**
 * Thrown when a run or resume is requested while another execution is in flight.
 */
public class ExecutionAlreadyRunningException extends RuntimeException {

    public ExecutionAlreadyRunningException(String runningId) {
        super(runningId == null
                ? "An execution is already running"
                : "Execution " + runningId + " is already running");
    }
}
