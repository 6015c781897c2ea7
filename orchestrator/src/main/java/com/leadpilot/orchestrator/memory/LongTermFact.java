package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One durable observation about an entity, as recorded by one run.
 *
 * Facts are only ever appended. The current view of a key is derived from its
 * history by {@link EntityMemory#currentView()}.
 *
 * @param value for COLLECTION facts an array node; for POINT facts any node
 */
public record LongTermFact(
        String   key,
        FactKind kind,
        JsonNode value,
        int      importance,
        Instant  recordedAt,
        String   executionId) {

    public static LongTermFact point(String key, JsonNode value, int importance,
                                     Instant at, String executionId) {
        return new LongTermFact(key, FactKind.POINT, value, MemoryManager.clampImportance(importance),
                at, executionId);
    }

    public static LongTermFact collection(String key, JsonNode values, int importance,
                                          Instant at, String executionId) {
        return new LongTermFact(key, FactKind.COLLECTION, values, MemoryManager.clampImportance(importance),
                at, executionId);
    }
}
