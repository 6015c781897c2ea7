package com.leadpilot.orchestrator.service;

public class ExecutionNotFoundException extends RuntimeException {

    public ExecutionNotFoundException(String reference) {
        super("No execution matches '" + reference + "'");
    }
}
