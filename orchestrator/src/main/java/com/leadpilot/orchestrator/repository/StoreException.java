package com.leadpilot.orchestrator.repository;

/**
 * Thrown when a checkpoint or memory record cannot be read or written.
 *
 * Unchecked: a storage failure is not something a stage can recover from, so it
 * propagates to the run loop, which fails loudly instead of silently dropping state.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
