package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadpilot.orchestrator.model.Execution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles the bounded context for one (entity, stage) invocation.
 *
 * <p>Budget priority, highest first:
 * <ol>
 *   <li>completed results of the current Execution, in stage order. The first
 *       entry that does not fit is cut and ends with {@link #TRUNCATION_MARKER};
 *       nothing after it is added.</li>
 *   <li>long-term facts from {@link MemoryManager#recall}, limited to the
 *       remaining budget.</li>
 *   <li>pattern hints for the stage, added while they fit.</li>
 * </ol>
 *
 * The current Execution is always passed in; this class holds no run state.
 */
@Component
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    public static final String TRUNCATION_MARKER = " ...[truncated]";

    private final MemoryManager memory;
    private final int maxChars;
    private final int recallMaxItems;

    public ContextBuilder(MemoryManager memory,
                          @Value("${leadpilot.context.max-chars:8000}") int maxChars,
                          @Value("${leadpilot.memory.recall-max-items:12}") int recallMaxItems) {
        this.memory         = memory;
        this.maxChars       = maxChars;
        this.recallMaxItems = recallMaxItems;
    }

    public ContextBundle build(String entityKey, String stageName, Execution execution) {
        List<ContextEntry> entries = new ArrayList<>();
        int remaining = maxChars;
        boolean truncated = false;

        // 1. current run
        for (Map.Entry<String, JsonNode> e : execution.completedData().entrySet()) {
            if (e.getKey().equals(stageName)) {
                continue;
            }
            ContextEntry entry = new ContextEntry(ContextEntry.Source.CURRENT_RUN, e.getKey(), e.getValue().toString());
            if (entry.cost() <= remaining) {
                entries.add(entry);
                remaining -= entry.cost();
                continue;
            }
            truncated = true;
            ContextEntry cut = cut(entry, remaining);
            if (cut != null) {
                entries.add(cut);
                remaining -= cut.cost();
            }
            remaining = 0;
            break;
        }

        // 2. long-term facts
        if (remaining > 0) {
            List<RecalledFact> facts = memory.recall(entityKey, new RecallBudget(recallMaxItems, remaining));
            for (RecalledFact f : facts) {
                entries.add(new ContextEntry(ContextEntry.Source.LONG_TERM, f.key(), f.valueText()));
                remaining -= f.cost();
            }
            if (facts.stream().anyMatch(f -> f.omitted() > 0)
                    || facts.size() < recallMaxItems
                    && memory.recall(entityKey, RecallBudget.items(recallMaxItems)).size() > facts.size()) {
                truncated = true;
            }
        } else if (!memory.recall(entityKey, RecallBudget.items(1)).isEmpty()) {
            truncated = true;
        }

        // 3. pattern hints
        JsonNode discovery = execution.completedData().get("discovery");
        String sizeHint = discovery == null ? null : discovery.path("size").asText(null);
        SizeBucket bucket = memory.bucketFor(entityKey, sizeHint);
        for (PatternStats p : memory.patternHints(stageName, bucket)) {
            ContextEntry entry = new ContextEntry(ContextEntry.Source.PATTERN, "pattern", p.describe());
            if (entry.cost() > remaining) {
                truncated = true;
                break;
            }
            entries.add(entry);
            remaining -= entry.cost();
        }

        ContextBundle bundle = new ContextBundle(entityKey, stageName, entries, maxChars, truncated);
        log.debug("Context for stage '{}': {} entries, {}/{} chars{}", stageName, entries.size(),
                bundle.usedChars(), maxChars, truncated ? " (truncated)" : "");
        return bundle;
    }

    /** Shorten an entry to fit {@code budget}, or null if not even the marker fits. */
    private static ContextEntry cut(ContextEntry entry, int budget) {
        // label + ": " + text + marker + newline
        int room = budget - entry.label().length() - 2 - TRUNCATION_MARKER.length() - 1;
        if (room <= 0) {
            return null;
        }
        String text = entry.text().substring(0, Math.min(room, entry.text().length())) + TRUNCATION_MARKER;
        return new ContextEntry(entry.source(), entry.label(), text);
    }
}
