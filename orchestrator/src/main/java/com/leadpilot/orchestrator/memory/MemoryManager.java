package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.leadpilot.orchestrator.model.ResearchRequest;
import com.leadpilot.orchestrator.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Three-tier memory: working (current run), long-term (per entity, durable) and
 * pattern (aggregated stage outcomes).
 *
 * <p>Working memory lives only in this bean and is bounded; when full, the
 * entry with the lowest importance is evicted (the oldest one among equals).
 * At the terminal end of a run, entries at or above the promotion threshold
 * are folded into the entity's long-term {@code notes} collection. A paused run
 * discards its working tier; the durable checkpoint is what survives a pause.
 *
 * <p>Long-term and pattern tiers are persisted through {@link KeyValueStore}s.
 * All public methods are synchronized: the pipeline worker writes while API
 * threads read.
 */
@Service
public class MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(MemoryManager.class);

    public static final String NOTES_KEY = "notes";

    private static final Comparator<RecalledFact> RECALL_ORDER =
            Comparator.comparing(RecalledFact::recordedAt, Comparator.reverseOrder())
                    .thenComparing(RecalledFact::importance, Comparator.reverseOrder())
                    .thenComparing(RecalledFact::key);

    private final KeyValueStore<EntityMemory> longTerm;
    private final KeyValueStore<PatternStats> patterns;
    private final Clock clock;
    private final int   workingMaxItems;
    private final int   promotionThreshold;

    private final List<WorkingMemoryEntry> working = new ArrayList<>();
    private String activeExecutionId;

    public MemoryManager(KeyValueStore<EntityMemory> longTerm,
                         KeyValueStore<PatternStats> patterns,
                         Clock clock,
                         @Value("${leadpilot.memory.working-max-items:20}") int workingMaxItems,
                         @Value("${leadpilot.memory.promotion-threshold:8}") int promotionThreshold) {
        if (workingMaxItems < 1) {
            throw new IllegalArgumentException("leadpilot.memory.working-max-items must be positive");
        }
        this.longTerm           = longTerm;
        this.patterns           = patterns;
        this.clock              = clock;
        this.workingMaxItems    = workingMaxItems;
        this.promotionThreshold = promotionThreshold;
    }

    public static int clampImportance(int importance) {
        return Math.max(1, Math.min(10, importance));
    }

    // ------------------------------------------------------------------
    // Working tier
    // ------------------------------------------------------------------

    /** Start a fresh working tier for a run. Anything left from a previous run is dropped. */
    public synchronized void beginRun(String executionId) {
        if (!working.isEmpty()) {
            log.debug("Discarding {} working-memory entries left by run {}", working.size(), activeExecutionId);
        }
        working.clear();
        activeExecutionId = executionId;
    }

    public synchronized void rememberWorking(String eventType, JsonNode payload, int importance) {
        JsonNode body = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        working.add(new WorkingMemoryEntry(eventType, body, clampImportance(importance), clock.instant()));
        while (working.size() > workingMaxItems) {
            WorkingMemoryEntry victim = working.get(0);
            for (WorkingMemoryEntry e : working) {
                if (e.importance() < victim.importance()) {
                    victim = e;
                }
            }
            working.remove(victim);
        }
    }

    public synchronized List<WorkingMemoryEntry> workingEntries() {
        return List.copyOf(working);
    }

    /**
     * Close the working tier.
     *
     * @param entityKey entity whose notes receive promoted entries
     * @param promote   true at a terminal end (completed or failed); false on pause
     */
    public synchronized void endRun(String entityKey, boolean promote) {
        try {
            if (!promote || entityKey == null || entityKey.isBlank()) {
                return;
            }
            ArrayNode notes = JsonNodeFactory.instance.arrayNode();
            int importance = 0;
            for (WorkingMemoryEntry e : working) {
                if (e.importance() >= promotionThreshold) {
                    notes.add(e.summary());
                    importance = Math.max(importance, e.importance());
                }
            }
            if (!notes.isEmpty()) {
                log.debug("Promoting {} working-memory entries for '{}'", notes.size(), entityKey);
                rememberLongTerm(entityKey, null, List.of(
                        LongTermFact.collection(NOTES_KEY, notes, importance, clock.instant(), activeExecutionId)));
            }
        } finally {
            working.clear();
            activeExecutionId = null;
        }
    }

    // ------------------------------------------------------------------
    // Long-term tier
    // ------------------------------------------------------------------

    public synchronized void rememberLongTerm(String entityKey, LongTermFact fact) {
        rememberLongTerm(entityKey, null, List.of(fact));
    }

    /**
     * Append facts to an entity's history. Nothing already recorded is modified.
     *
     * @param displayName human-readable entity name, kept as the latest non-blank one seen
     */
    public synchronized void rememberLongTerm(String entityKey, String displayName, List<LongTermFact> facts) {
        String key = ResearchRequest.normalize(entityKey);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Entity key must not be blank");
        }
        Instant now = clock.instant();
        EntityMemory memory = longTerm.load(key)
                .orElseGet(() -> new EntityMemory(key, displayName != null ? displayName : entityKey, now));
        memory.setDisplayName(displayName);
        for (LongTermFact f : facts) {
            memory.append(f, now);
        }
        longTerm.save(key, memory);
    }

    /** Mark one more completed analysis of an entity. */
    public synchronized void recordAnalysis(String entityKey, String displayName) {
        String key = ResearchRequest.normalize(entityKey);
        Instant now = clock.instant();
        EntityMemory memory = longTerm.load(key)
                .orElseGet(() -> new EntityMemory(key, displayName, now));
        memory.setDisplayName(displayName);
        memory.incrementTimesAnalyzed();
        longTerm.save(key, memory);
    }

    /**
     * Current view of an entity's facts, most relevant first, cut to the budget.
     * Facts that fit whole are taken in recall order; one that would exceed the
     * character budget is passed over and the next one is tried. Room left after
     * that goes to the passed-over collections, cut to their newest elements with
     * the number left out recorded on the fact.
     */
    public synchronized List<RecalledFact> recall(String entityKey, RecallBudget budget) {
        Optional<EntityMemory> memory = longTerm.load(ResearchRequest.normalize(entityKey));
        if (memory.isEmpty()) {
            return List.of();
        }
        List<RecalledFact> ordered = new ArrayList<>(memory.get().currentView().values());
        ordered.sort(RECALL_ORDER);

        List<RecalledFact> out = new ArrayList<>();
        List<RecalledFact> passedOver = new ArrayList<>();
        long used = 0;
        for (RecalledFact f : ordered) {
            if (out.size() >= budget.maxItems()) {
                break;
            }
            if (used + f.cost() > budget.maxChars()) {
                passedOver.add(f);
                continue;
            }
            out.add(f);
            used += f.cost();
        }
        for (RecalledFact f : passedOver) {
            if (out.size() >= budget.maxItems()) {
                break;
            }
            RecalledFact cut = newestFitting(f, budget.maxChars() - used);
            if (cut != null) {
                out.add(cut);
                used += cut.cost();
            }
        }
        out.sort(RECALL_ORDER);
        return out;
    }

    /** Largest newest-elements cut of a collection that fits in {@code room}, or null. */
    private static RecalledFact newestFitting(RecalledFact f, long room) {
        if (f.kind() != FactKind.COLLECTION || f.value() == null || !f.value().isArray()) {
            return null;
        }
        int lo = 0;
        int hi = f.value().size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (f.newest(mid).cost() <= room) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo == 0 ? null : f.newest(lo);
    }

    public synchronized Optional<EntityMemory> entity(String entityKey) {
        return longTerm.load(ResearchRequest.normalize(entityKey));
    }

    /** @return true if the entity had long-term memory */
    public synchronized boolean forget(String entityKey) {
        boolean removed = longTerm.delete(ResearchRequest.normalize(entityKey));
        if (removed) {
            log.info("Forgot long-term memory of '{}'", entityKey);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Pattern tier
    // ------------------------------------------------------------------

    public synchronized void recordOutcome(String entityKey, String stage, StageOutcome outcome) {
        SizeBucket bucket = bucketFor(entityKey, outcome.sizeHint());
        String key = PatternStats.keyOf(stage, bucket);
        PatternStats stats = patterns.load(key).orElseGet(() -> new PatternStats(stage, bucket));
        stats.record(outcome, clock.instant());
        patterns.save(key, stats);
    }

    /**
     * Statistics for a stage, the requested bucket first, then the remaining
     * buckets by sample count.
     */
    public synchronized List<PatternStats> patternHints(String stage, SizeBucket preferred) {
        List<PatternStats> out = new ArrayList<>();
        patterns.load(PatternStats.keyOf(stage, preferred)).ifPresent(out::add);
        patterns.loadAll().stream()
                .filter(p -> p.getStage().equals(stage) && p.getBucket() != preferred)
                .sorted(Comparator.comparingLong(PatternStats::samples).reversed())
                .forEach(out::add);
        return out;
    }

    /**
     * Size bucket for an entity: the explicit hint when it classifies, else
     * the size recorded in long-term memory.
     */
    public synchronized SizeBucket bucketFor(String entityKey, String sizeHint) {
        SizeBucket fromHint = SizeBucket.fromHint(sizeHint);
        if (fromHint != SizeBucket.UNKNOWN || entityKey == null) {
            return fromHint;
        }
        return longTerm.load(ResearchRequest.normalize(entityKey))
                .map(m -> m.currentView().get(FactExtractor.SIZE))
                .map(f -> SizeBucket.fromHint(f.valueText()))
                .orElse(SizeBucket.UNKNOWN);
    }
}
