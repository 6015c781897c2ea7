package com.leadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One end-to-end run of the research pipeline for one input.
 *
 * An Execution owns an ordered map of StageResults, one per stage that has been
 * touched so far. Insertion order follows stage order because stages are only
 * ever started sequentially.
 *
 * Persisted as one JSON checkpoint per execution (see ExecutionStateStore).
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Execution {

    private String id;

    // Raw operator request, e.g. "Acme, Roles: CEO, VP Sales".
    private String input;

    // Display name of the target entity parsed from the input.
    private String entity;

    private ExecutionStatus status = ExecutionStatus.PENDING;

    private Map<String, StageResult> stageResults = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    // Last interruption or failure reason. Cleared on resume.
    private String error;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Execution() {}   // required by Jackson

    public Execution(String id, String input, String entity, Instant createdAt) {
        this.id        = id;
        this.input     = input;
        this.entity    = entity;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getId()          { return id; }
    public String          getInput()       { return input; }
    public String          getEntity()      { return entity; }
    public ExecutionStatus getStatus()      { return status; }
    public Instant         getCreatedAt()   { return createdAt; }
    public Instant         getUpdatedAt()   { return updatedAt; }
    public Instant         getCompletedAt() { return completedAt; }
    public String          getError()       { return error; }

    public void setStatus(ExecutionStatus status) { this.status = status; }
    public void setError(String error)            { this.error = error; }
    public void setCompletedAt(Instant t)         { this.completedAt = t; }

    /** Refresh updatedAt; called on every mutation before a checkpoint. */
    public void touch(Instant now) {
        this.updatedAt = now;
    }

    // ------------------------------------------------------------------
    // Stage results
    // ------------------------------------------------------------------

    /** Read-only view in stage order. */
    public Map<String, StageResult> getStageResults() {
        return Collections.unmodifiableMap(stageResults);
    }

    public Optional<StageResult> stage(String stageName) {
        return Optional.ofNullable(stageResults.get(stageName));
    }

    /** The result record for a stage, created as PENDING on first access. */
    public StageResult stageOrCreate(String stageName) {
        return stageResults.computeIfAbsent(stageName, k -> new StageResult());
    }

    /** Data of every COMPLETED stage, keyed by stage name, in stage order. */
    public Map<String, JsonNode> completedData() {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        stageResults.forEach((name, r) -> {
            if (r.getStatus() == StageStatus.COMPLETED && r.hasData()) {
                out.put(name, r.getData());
            }
        });
        return out;
    }

    public boolean isTerminal() {
        return status == ExecutionStatus.COMPLETED;
    }

    /**
     * Value copy of this execution. The stage-results map, every StageResult and
     * every data tree are cloned, so mutating the copy never reaches the original.
     */
    public Execution deepCopy() {
        Execution copy = new Execution(id, input, entity, createdAt);
        copy.status      = status;
        copy.updatedAt   = updatedAt;
        copy.completedAt = completedAt;
        copy.error       = error;
        stageResults.forEach((name, r) -> copy.stageResults.put(name, r.deepCopy()));
        return copy;
    }
}
