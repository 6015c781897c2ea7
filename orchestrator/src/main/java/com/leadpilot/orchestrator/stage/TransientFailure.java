package com.leadpilot.orchestrator.stage;

/**
 * Implemented by collaborator exceptions that know whether retrying can help
 * (HTTP 429, 5xx, connection resets). The registry uses it to classify the
 * {@link StageFailure} it raises.
 */
public interface TransientFailure {

    boolean isTransient();

    default StageFailure.Kind failureKind() {
        return StageFailure.Kind.PROVIDER_ERROR;
    }
}
