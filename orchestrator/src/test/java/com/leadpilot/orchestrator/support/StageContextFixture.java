package com.leadpilot.orchestrator.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadpilot.orchestrator.memory.ContextBundle;
import com.leadpilot.orchestrator.model.ResearchRequest;
import com.leadpilot.orchestrator.stage.StageContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds a {@link StageContext} for calling a stage directly, recording what the
 * stage committed and noted.
 */
public class StageContextFixture {

    public record Note(String eventType, JsonNode payload, int importance) {}

    private final String input;
    private final Map<String, JsonNode> prior = new LinkedHashMap<>();

    public final AtomicBoolean  stopRequested = new AtomicBoolean(false);
    public final List<JsonNode> partials      = new ArrayList<>();
    public final List<Note>     notes         = new ArrayList<>();

    public StageContextFixture(String input) {
        this.input = input;
    }

    public StageContextFixture prior(String stage, JsonNode data) {
        prior.put(stage, data);
        return this;
    }

    public StageContext contextFor(String stageName) {
        ResearchRequest request = ResearchRequest.parse(input);
        return new StageContext("exec-1", stageName, request, prior,
                ContextBundle.empty(request.entityKey(), stageName),
                stopRequested::get,
                partials::add,
                (type, payload, importance) -> notes.add(new Note(type, payload, importance)));
    }
}
