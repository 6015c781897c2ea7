package com.leadpilot.orchestrator.provider;

import com.leadpilot.orchestrator.stage.TransientFailure;

/**
 * Thrown when a contact-enrichment provider returns an error or is unreachable.
 */
public class ProviderException extends RuntimeException implements TransientFailure {

    private final int statusCode;

    public ProviderException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /** Transport-level failure; no HTTP status. */
    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }

    @Override
    public boolean isTransient() {
        return statusCode == -1 || statusCode == 429 || statusCode >= 500;
    }
}
