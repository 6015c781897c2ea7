package com.leadpilot.orchestrator.memory;

/**
 * Merge policy for a long-term fact key.
 */
public enum FactKind {
    /** Single value; the latest recorded value wins (e.g. confidence_score). */
    POINT,
    /** Array value; values accumulate as a union across runs (e.g. aliases). */
    COLLECTION
}
