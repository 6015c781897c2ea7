package com.leadpilot.orchestrator.stage;

/**
 * Identity and ordering contract for a stage.
 *
 * @param name        Unique stage name; the key in an Execution's stage results
 *                    and in the pattern-memory statistics (e.g. "enrichment").
 * @param order       Position in the pipeline; lower runs first.
 * @param description One-line summary shown in logs and the help output.
 * @param policy      Abort or continue when the stage fails.
 */
public record StageDefinition(
        String      name,
        int         order,
        String      description,
        StagePolicy policy) {}
