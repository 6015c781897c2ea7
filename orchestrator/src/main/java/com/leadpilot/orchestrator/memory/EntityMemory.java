package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Long-term memory of one entity: the full, append-only fact history.
 *
 * Persisted as one record per entity, keyed by the case-normalized name.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityMemory {

    private String entityKey;
    private String displayName;
    private List<LongTermFact> facts = new ArrayList<>();
    private int timesAnalyzed;
    private Instant createdAt;
    private Instant updatedAt;

    protected EntityMemory() {}   // required by Jackson

    public EntityMemory(String entityKey, String displayName, Instant createdAt) {
        this.entityKey   = entityKey;
        this.displayName = displayName;
        this.createdAt   = createdAt;
        this.updatedAt   = createdAt;
    }

    public String             getEntityKey()     { return entityKey; }
    public String             getDisplayName()   { return displayName; }
    public List<LongTermFact> getFacts()         { return Collections.unmodifiableList(facts); }
    public int                getTimesAnalyzed() { return timesAnalyzed; }
    public Instant            getCreatedAt()     { return createdAt; }
    public Instant            getUpdatedAt()     { return updatedAt; }

    public void append(LongTermFact fact, Instant now) {
        facts.add(fact);
        updatedAt = now;
    }

    public void incrementTimesAnalyzed() {
        timesAnalyzed++;
    }

    public void setDisplayName(String displayName) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
    }

    /**
     * Current value per key.
     *
     * POINT keys: the most recently recorded value (later append wins a tie).
     * COLLECTION keys: union of every recorded element in first-seen order,
     * with the newest timestamp and highest importance of its contributions.
     */
    public Map<String, RecalledFact> currentView() {
        Map<String, RecalledFact> view = new LinkedHashMap<>();
        Map<String, Set<JsonNode>> unions = new LinkedHashMap<>();

        for (LongTermFact f : facts) {
            if (f.kind() == FactKind.POINT) {
                RecalledFact prev = view.get(f.key());
                if (prev == null || !f.recordedAt().isBefore(prev.recordedAt())) {
                    view.put(f.key(), new RecalledFact(f.key(), FactKind.POINT, f.value(),
                            f.importance(), f.recordedAt()));
                }
                continue;
            }
            Set<JsonNode> union = unions.computeIfAbsent(f.key(), k -> new LinkedHashSet<>());
            if (f.value().isArray()) {
                f.value().forEach(union::add);
            } else {
                union.add(f.value());
            }
            RecalledFact prev = view.get(f.key());
            Instant at = prev == null || f.recordedAt().isAfter(prev.recordedAt()) ? f.recordedAt() : prev.recordedAt();
            int importance = prev == null ? f.importance() : Math.max(prev.importance(), f.importance());
            view.put(f.key(), new RecalledFact(f.key(), FactKind.COLLECTION, null, importance, at));
        }

        unions.forEach((key, elements) -> {
            ArrayNode arr = JsonNodeFactory.instance.arrayNode();
            elements.forEach(arr::add);
            RecalledFact meta = view.get(key);
            view.put(key, new RecalledFact(key, FactKind.COLLECTION, arr, meta.importance(), meta.recordedAt()));
        });
        return view;
    }
}
