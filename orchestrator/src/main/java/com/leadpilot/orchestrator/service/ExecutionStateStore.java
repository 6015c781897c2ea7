package com.leadpilot.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;
import com.leadpilot.orchestrator.model.ResearchRequest;
import com.leadpilot.orchestrator.model.StageResult;
import com.leadpilot.orchestrator.model.StageStatus;
import com.leadpilot.orchestrator.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Durable lifecycle of Executions.
 *
 * Every mutation refreshes {@code updatedAt} and writes a checkpoint before
 * returning, so the file on disk always reflects the last transition. The
 * checkpoint for a stage start is written before the stage body runs.
 *
 * All methods are synchronized: the pipeline worker mutates the current
 * Execution while API threads take snapshots of it.
 */
@Service
public class ExecutionStateStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateStore.class);

    private static final Pattern ORDINAL = Pattern.compile("\\d{1,4}");

    // Newest first. Ties broken by creation time, then id, so listings are stable.
    private static final Comparator<Execution> NEWEST_FIRST =
            Comparator.comparing(Execution::getUpdatedAt, Comparator.reverseOrder())
                    .thenComparing(Execution::getCreatedAt, Comparator.reverseOrder())
                    .thenComparing(Execution::getId);

    private final KeyValueStore<Execution> store;
    private final Clock clock;

    public ExecutionStateStore(KeyValueStore<Execution> store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Creation and activation
    // ------------------------------------------------------------------

    /**
     * New PENDING execution, persisted immediately.
     *
     * @throws IllegalArgumentException if the input does not name a company
     */
    public synchronized Execution create(String input) {
        ResearchRequest request = ResearchRequest.parse(input);
        Execution e = new Execution(UUID.randomUUID().toString(), input.strip(), request.company(), clock.instant());
        checkpoint(e);
        log.info("Created execution {} for '{}'", e.getId(), e.getEntity());
        return e;
    }

    /** Make a new execution current and RUNNING. */
    public synchronized void activate(ExecutionSlot slot, Execution execution) {
        if (execution.isTerminal()) {
            throw new AlreadyCompletedException(execution.getId());
        }
        slot.clear();
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setError(null);
        checkpoint(execution);
        slot.load(execution);
    }

    // ------------------------------------------------------------------
    // Stage transitions
    // ------------------------------------------------------------------

    /** Stage RUNNING, attempts + 1, previous data and error dropped. */
    public synchronized void startStage(Execution execution, String stage) {
        StageResult r = execution.stageOrCreate(stage);
        r.setStatus(StageStatus.RUNNING);
        r.setData(null);
        r.setError(null);
        r.setStartedAt(clock.instant());
        r.setFinishedAt(null);
        r.incrementAttempts();
        checkpoint(execution);
    }

    /** Checkpoint data gathered so far; the stage stays RUNNING. */
    public synchronized void savePartialResult(Execution execution, String stage, JsonNode data) {
        StageResult r = execution.stageOrCreate(stage);
        r.setStatus(StageStatus.RUNNING);
        r.setData(data == null ? null : data.deepCopy());
        checkpoint(execution);
        log.debug("Saved partial result for stage '{}'", stage);
    }

    public synchronized void completeStage(Execution execution, String stage, JsonNode data) {
        StageResult r = execution.stageOrCreate(stage);
        r.setStatus(StageStatus.COMPLETED);
        r.setData(data);
        r.setError(null);
        r.setFinishedAt(clock.instant());
        checkpoint(execution);
    }

    /** Record the failure. Data already saved for the stage is left as it is. */
    public synchronized void failStage(Execution execution, String stage, String error) {
        StageResult r = execution.stageOrCreate(stage);
        r.setStatus(StageStatus.FAILED);
        r.setError(error);
        r.setFinishedAt(clock.instant());
        checkpoint(execution);
    }

    public synchronized void skipStage(Execution execution, String stage, String reason) {
        StageResult r = execution.stageOrCreate(stage);
        r.setStatus(StageStatus.SKIPPED);
        r.setData(JsonNodeFactory.instance.objectNode().put("reason", reason));
        r.setFinishedAt(clock.instant());
        checkpoint(execution);
    }

    // ------------------------------------------------------------------
    // Execution transitions
    // ------------------------------------------------------------------

    /**
     * Pause the current execution. The slot keeps referring to it.
     *
     * @throws NoActiveExecutionException if the slot is empty
     */
    public synchronized Execution pauseExecution(ExecutionSlot slot, String reason) {
        Execution e = slot.current().orElseThrow(NoActiveExecutionException::new);
        e.setStatus(ExecutionStatus.PAUSED);
        e.setError(reason);
        checkpoint(e);
        log.info("Paused execution {}: {}", e.getId(), reason);
        return e;
    }

    /**
     * Load a stored execution as the current one, RUNNING again.
     *
     * The slot receives a deep copy of the stored record, so nothing that was
     * read from the store is shared with the running copy.
     *
     * @throws ExecutionNotFoundException if no execution has this id
     * @throws AlreadyCompletedException  if it is completed; nothing is modified
     */
    public synchronized Execution resumeExecution(ExecutionSlot slot, String executionId) {
        Execution stored = store.load(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (stored.isTerminal()) {
            throw new AlreadyCompletedException(executionId);
        }
        slot.clear();
        Execution e = stored.deepCopy();
        e.setStatus(ExecutionStatus.RUNNING);
        e.setError(null);
        checkpoint(e);
        slot.load(e);
        log.info("Resumed execution {} ('{}')", e.getId(), e.getEntity());
        return e;
    }

    public synchronized void completeExecution(Execution execution) {
        Instant now = clock.instant();
        execution.setStatus(ExecutionStatus.COMPLETED);
        execution.setCompletedAt(now);
        execution.setError(null);
        checkpoint(execution);
    }

    public synchronized void failExecution(Execution execution, String error) {
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setError(error);
        checkpoint(execution);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Executions that can be resumed (paused, failed, or left running by a crash), newest first. */
    public List<Execution> listResumable() {
        return store.loadAll().stream()
                .filter(e -> e.getStatus().isResumable())
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public List<Execution> listAll() {
        return store.loadAll().stream().sorted(NEWEST_FIRST).toList();
    }

    public Optional<Execution> find(String executionId) {
        return store.load(executionId);
    }

    /** Deep copy of the current execution, safe to hand to another thread. */
    public synchronized Optional<Execution> snapshot(ExecutionSlot slot) {
        return slot.current().map(Execution::deepCopy);
    }

    /**
     * Resolve an operator reference to an execution id.
     *
     * A small positive number N selects the N-th entry of {@link #listResumable()};
     * anything else is taken as an id.
     *
     * @throws ExecutionNotFoundException if nothing matches
     */
    public String resolveReference(String reference) {
        String ref = reference == null ? "" : reference.strip();
        if (ORDINAL.matcher(ref).matches()) {
            int n = Integer.parseInt(ref);
            List<Execution> resumable = listResumable();
            if (n < 1 || n > resumable.size()) {
                throw new ExecutionNotFoundException("#" + ref);
            }
            return resumable.get(n - 1).getId();
        }
        if (ref.isEmpty() || store.load(ref).isEmpty()) {
            throw new ExecutionNotFoundException(ref);
        }
        return ref;
    }

    /**
     * Delete completed executions whose completion is older than the cutoff.
     *
     * @return number of checkpoints removed
     */
    public int purgeCompletedBefore(Instant cutoff) {
        int removed = 0;
        for (Execution e : store.loadAll()) {
            Instant finished = e.getCompletedAt() != null ? e.getCompletedAt() : e.getUpdatedAt();
            if (e.getStatus() == ExecutionStatus.COMPLETED && finished.isBefore(cutoff)) {
                if (store.delete(e.getId())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Purged {} completed executions finished before {}", removed, cutoff);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void checkpoint(Execution execution) {
        execution.touch(clock.instant());
        store.save(execution.getId(), execution);
    }
}
