package com.leadpilot.orchestrator.service;

/**
 * Reply to an operator command.
 *
 * @param executionId execution the command acted on, if any
 */
public record CommandResult(boolean ok, String message, String executionId) {

    public static CommandResult ok(String message) {
        return new CommandResult(true, message, null);
    }

    public static CommandResult ok(String message, String executionId) {
        return new CommandResult(true, message, executionId);
    }

    public static CommandResult error(String message) {
        return new CommandResult(false, message, null);
    }
}
