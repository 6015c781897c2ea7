package com.leadpilot.orchestrator.stage;

/**
 * A stage raised or returned a typed error.
 *
 * Recorded into the stage's result and then handled according to the stage's
 * {@link StagePolicy}. Retryable failures are attempted again first.
 */
public class StageFailure extends RuntimeException {

    public enum Kind { PROVIDER_ERROR, LLM_ERROR, PARSE_ERROR, UNEXPECTED }

    private final Kind    kind;
    private final boolean retryable;

    public StageFailure(Kind kind, String message) {
        this(kind, message, false, null);
    }

    public StageFailure(Kind kind, String message, boolean retryable, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind      = kind;
        this.retryable = retryable;
    }

    public Kind    getKind()     { return kind; }
    public boolean isRetryable() { return retryable; }
}
