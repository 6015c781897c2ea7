package com.leadpilot.orchestrator.service;

import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;

import java.util.Optional;

/**
 * Holder of the orchestrator's current Execution; at most one at a time.
 *
 * Owned by {@link PipelineOrchestrator} and passed explicitly to the
 * {@link ExecutionStateStore} operations that need it.
 */
public class ExecutionSlot {

    private Execution current;

    public synchronized Optional<Execution> current() {
        return Optional.ofNullable(current);
    }

    /** Replace the current execution; the previous reference, if any, is dropped. */
    public synchronized void load(Execution execution) {
        current = execution;
    }

    public synchronized void clear() {
        current = null;
    }

    /** True while the current execution is RUNNING. A paused execution stays loaded but is not active. */
    public synchronized boolean isActive() {
        return current != null && current.getStatus() == ExecutionStatus.RUNNING;
    }
}
