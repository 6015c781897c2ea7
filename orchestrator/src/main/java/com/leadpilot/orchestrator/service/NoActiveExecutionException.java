package com.leadpilot.orchestrator.service;

/**
 * Thrown by stop/pause when no execution is running. Nothing is checkpointed.
 */
public class NoActiveExecutionException extends RuntimeException {

    public NoActiveExecutionException() {
        super("No execution is running");
    }
}
