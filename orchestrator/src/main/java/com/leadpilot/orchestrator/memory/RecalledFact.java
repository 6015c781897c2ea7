package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;

/**
 * Current value of one fact key, as returned by {@link MemoryManager#recall}.
 *
 * @param omitted older collection elements left out to fit a budget; 0 for a complete value
 */
public record RecalledFact(
        String   key,
        FactKind kind,
        JsonNode value,
        int      importance,
        Instant  recordedAt,
        int      omitted) {

    public RecalledFact(String key, FactKind kind, JsonNode value, int importance, Instant recordedAt) {
        this(key, kind, value, importance, recordedAt, 0);
    }

    public String valueText() {
        String text = value.isValueNode() ? value.asText() : value.toString();
        return omitted > 0 ? text + " (+" + omitted + " older)" : text;
    }

    /** "key: value", the form injected into stage context. */
    public String render() {
        return key + ": " + valueText();
    }

    /** Characters this fact consumes from a budget (rendered line plus newline). */
    public int cost() {
        return render().length() + 1;
    }

    /**
     * Copy of a collection fact holding only its {@code n} newest elements.
     * Elements are kept in first-seen order, so the newest are at the end.
     */
    public RecalledFact newest(int n) {
        if (kind != FactKind.COLLECTION || !value.isArray() || n >= value.size()) {
            return this;
        }
        ArrayNode kept = JsonNodeFactory.instance.arrayNode();
        for (int i = value.size() - n; i < value.size(); i++) {
            kept.add(value.get(i));
        }
        return new RecalledFact(key, kind, kept, importance, recordedAt, omitted + value.size() - n);
    }
}
