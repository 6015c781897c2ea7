package com.leadpilot.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum EventType {
    @JsonProperty("progress") PROGRESS,
    @JsonProperty("log")      LOG,
    @JsonProperty("result")   RESULT,
    @JsonProperty("error")    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
