package com.leadpilot.orchestrator.events;

/**
 * Receives pipeline events. Called synchronously on the pipeline thread right
 * after the state transition the event describes; implementations must not block.
 */
@FunctionalInterface
public interface EventSink {

    void publish(PipelineEvent event);
}
