package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * High-detail event of the current run. Never persisted on its own.
 */
public record WorkingMemoryEntry(
        String   eventType,
        JsonNode payload,
        int      importance,
        Instant  timestamp) {

    /** Short text used when the entry is promoted to long-term memory. */
    public String summary() {
        JsonNode s = payload.path("summary");
        if (s.isTextual() && !s.asText().isBlank()) {
            return s.asText();
        }
        String text = eventType + ": " + (payload.isValueNode() ? payload.asText() : payload.toString());
        return text.length() > 200 ? text.substring(0, 197) + "..." : text;
    }
}
