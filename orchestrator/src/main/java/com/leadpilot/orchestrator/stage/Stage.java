package com.leadpilot.orchestrator.stage;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One named unit of work in the research pipeline.
 *
 * A stage is a function of (input, accumulated context) → result. It may call
 * the LLM and external providers. It signals failure by throwing; the
 * {@link StageRegistry} converts anything it throws into a {@link StageFailure}.
 *
 * Long stages should call {@link StageContext#checkCancelled()} between external
 * calls so a stop request takes effect without waiting for the whole stage.
 */
public interface Stage {

    StageDefinition definition();

    JsonNode execute(StageContext ctx);

    /**
     * True when this result means the remaining stages must not run
     * (e.g. discovery rejected the company). Defaults to false.
     */
    default boolean endsPipeline(JsonNode result) {
        return false;
    }
}
