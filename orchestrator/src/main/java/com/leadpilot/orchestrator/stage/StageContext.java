package com.leadpilot.orchestrator.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.leadpilot.orchestrator.memory.ContextBundle;
import com.leadpilot.orchestrator.model.ResearchRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Everything a stage invocation can see and do.
 *
 * Built fresh by the orchestrator for every stage attempt. Stages never touch the
 * Execution or the state store directly; they go through the callbacks here.
 */
public class StageContext {

    /** Receives working-memory notes emitted by a stage. */
    @FunctionalInterface
    public interface NoteSink {
        void note(String eventType, JsonNode payload, int importance);
    }

    private final String                executionId;
    private final String                stageName;
    private final ResearchRequest       request;
    private final Map<String, JsonNode> priorResults;
    private final ContextBundle         context;
    private final BooleanSupplier       stopRequested;
    private final Consumer<JsonNode>    partialSink;
    private final NoteSink              notes;

    public StageContext(String executionId,
                        String stageName,
                        ResearchRequest request,
                        Map<String, JsonNode> priorResults,
                        ContextBundle context,
                        BooleanSupplier stopRequested,
                        Consumer<JsonNode> partialSink,
                        NoteSink notes) {
        this.executionId   = executionId;
        this.stageName     = stageName;
        this.request       = request;
        this.priorResults  = Collections.unmodifiableMap(new LinkedHashMap<>(priorResults));
        this.context       = context;
        this.stopRequested = stopRequested;
        this.partialSink   = partialSink;
        this.notes         = notes;
    }

    public String                executionId()  { return executionId; }
    public String                stageName()    { return stageName; }
    public ResearchRequest       request()      { return request; }
    public Map<String, JsonNode> priorResults() { return priorResults; }
    public ContextBundle         context()      { return context; }

    /** Result of an earlier stage of this run, or a MissingNode if it has none. */
    public JsonNode priorResult(String stage) {
        JsonNode node = priorResults.get(stage);
        return node == null ? MissingNode.getInstance() : node;
    }

    public boolean isCancelled() {
        return stopRequested.getAsBoolean();
    }

    /** Throws {@link StageInterruptedException} if a stop has been requested. */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new StageInterruptedException(stageName);
        }
    }

    /**
     * Checkpoint data gathered so far. The stage stays RUNNING; if the run is
     * interrupted now, resume restores this data instead of re-running the stage.
     */
    public void commitPartial(JsonNode data) {
        partialSink.accept(data);
    }

    /** Record an event in the run's working memory. */
    public void note(String eventType, JsonNode payload, int importance) {
        notes.note(eventType, payload, importance);
    }
}
