package com.leadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Record of one stage inside an Execution: {status, data, error}.
 *
 * data is the stage's opaque JSON output. It can be present while the status is
 * still RUNNING when the stage committed a partial result before an interruption.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageResult {

    private StageStatus status = StageStatus.PENDING;
    private JsonNode    data;
    private String      error;
    private Instant     startedAt;
    private Instant     finishedAt;
    private int         attempts;

    public StageResult() {}

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public StageStatus getStatus()     { return status; }
    public JsonNode    getData()       { return data; }
    public String      getError()      { return error; }
    public Instant     getStartedAt()  { return startedAt; }
    public Instant     getFinishedAt() { return finishedAt; }
    public int         getAttempts()   { return attempts; }

    public void setStatus(StageStatus status)   { this.status = status; }
    public void setData(JsonNode data)          { this.data = data; }
    public void setError(String error)          { this.error = error; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setFinishedAt(Instant t)        { this.finishedAt = t; }
    public void incrementAttempts()             { this.attempts++; }

    /** Non-null, non-empty data. An empty object or array counts as no data. */
    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode()
                && !(data.isContainerNode() && data.isEmpty());
    }

    public StageResult deepCopy() {
        StageResult copy = new StageResult();
        copy.status     = status;
        copy.data       = data == null ? null : data.deepCopy();
        copy.error      = error;
        copy.startedAt  = startedAt;
        copy.finishedAt = finishedAt;
        copy.attempts   = attempts;
        return copy;
    }
}
