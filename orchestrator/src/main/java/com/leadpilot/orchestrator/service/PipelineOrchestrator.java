package com.leadpilot.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.events.EventSink;
import com.leadpilot.orchestrator.events.PipelineEvent;
import com.leadpilot.orchestrator.memory.ContextBuilder;
import com.leadpilot.orchestrator.memory.ContextBundle;
import com.leadpilot.orchestrator.memory.FactExtractor;
import com.leadpilot.orchestrator.memory.MemoryManager;
import com.leadpilot.orchestrator.memory.StageOutcome;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ResearchRequest;
import com.leadpilot.orchestrator.model.StageResult;
import com.leadpilot.orchestrator.model.StageStatus;
import com.leadpilot.orchestrator.repository.StoreException;
import com.leadpilot.orchestrator.stage.Stage;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageFailure;
import com.leadpilot.orchestrator.stage.StageInterruptedException;
import com.leadpilot.orchestrator.stage.StagePolicy;
import com.leadpilot.orchestrator.stage.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the stage pipeline for one Execution at a time, with checkpointing,
 * cooperative stop and resume.
 *
 * <pre>
 *   run(input)     create → activate → stages 0..n
 *   stop()         sets a flag; the run pauses at the next safe point
 *   resume(id)     reload → reconcile the interrupted stage → continue
 * </pre>
 *
 * Safe points are: before every stage, and inside a stage wherever it calls
 * {@link StageContext#checkCancelled()}. A stage that returns normally after the
 * flag was raised is still committed; the pause then happens before the next one.
 *
 * <p>Every state transition is checkpointed by {@link ExecutionStateStore} and
 * then published to the {@link EventSink}, in that order and on the calling
 * thread. Runs are blocking; {@link PipelineRunner} puts them on a worker thread.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ExecutionStateStore store;
    private final StageRegistry       registry;
    private final ContextBuilder      contextBuilder;
    private final MemoryManager       memory;
    private final EventSink           events;
    private final Clock               clock;
    private final int                 maxStageAttempts;

    private final ExecutionSlot slot          = new ExecutionSlot();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public PipelineOrchestrator(ExecutionStateStore store,
                                StageRegistry registry,
                                ContextBuilder contextBuilder,
                                MemoryManager memory,
                                EventSink events,
                                Clock clock,
                                @Value("${leadpilot.pipeline.max-stage-attempts:2}") int maxStageAttempts) {
        this.store            = store;
        this.registry         = registry;
        this.contextBuilder   = contextBuilder;
        this.memory           = memory;
        this.events           = events;
        this.clock            = clock;
        this.maxStageAttempts = Math.max(1, maxStageAttempts);
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /** Create an execution for the input and run it to a terminal state or a pause. */
    public Execution run(String input) {
        ensureIdle();
        return run(store.create(input));
    }

    /**
     * Run an execution created by {@link ExecutionStateStore#create}.
     *
     * @throws ExecutionAlreadyRunningException if another execution is running
     */
    public Execution run(Execution execution) {
        ensureIdle();
        stopRequested.set(false);
        store.activate(slot, execution);
        memory.beginRun(execution.getId());
        publish(PipelineEvent.log(execution.getId(), null,
                "Starting analysis of " + execution.getEntity(), null, clock.instant()));
        return drive(execution, 0);
    }

    /**
     * Continue a paused, failed or crashed execution from its first unsettled stage.
     *
     * @throws ExecutionNotFoundException       if the id is unknown
     * @throws AlreadyCompletedException        if the execution is completed
     * @throws ExecutionAlreadyRunningException if another execution is running
     */
    public Execution resume(String executionId) {
        ensureIdle();
        stopRequested.set(false);
        Execution execution = store.resumeExecution(slot, executionId);
        memory.beginRun(execution.getId());

        ResumePoint point = resumePoint(execution);
        MDC.put("executionId", execution.getId());
        try {
            if (point.isFinished()) {
                log.info("Execution {} has no stage left to run", execution.getId());
                return complete(execution);
            }
            publish(PipelineEvent.log(execution.getId(), point.stage(),
                    "Resuming from stage '" + point.stage() + "'", null, clock.instant()));

            int start = point.index();
            switch (point.recovery()) {
                case RESTORED -> {
                    Stage stage = registry.get(point.stage());
                    JsonNode data = execution.stage(point.stage()).map(StageResult::getData).orElseThrow();
                    store.completeStage(execution, point.stage(), data);
                    publish(PipelineEvent.progress(execution.getId(), point.stage(), "completed", data, clock.instant()));
                    publish(PipelineEvent.log(execution.getId(), point.stage(),
                            "Restored saved data for stage '" + point.stage() + "'",
                            recoveryData("restored"), clock.instant()));
                    if (stage.endsPipeline(data)) {
                        return endEarly(execution, point.index());
                    }
                    start = point.index() + 1;
                }
                case FRESH -> {
                    boolean discarded = execution.stage(point.stage()).map(StageResult::hasData).orElse(false);
                    String message = discarded
                            ? "Discarding data saved by failed stage '" + point.stage() + "'; starting fresh"
                            : "No saved data for stage '" + point.stage() + "'; starting fresh";
                    log.warn(message);
                    publish(PipelineEvent.log(execution.getId(), point.stage(), message,
                            recoveryData("fresh"), clock.instant()));
                }
                case NONE -> { }
            }
            return drive(execution, start);
        } finally {
            MDC.remove("executionId");
        }
    }

    /**
     * Ask the running execution to pause at its next safe point. Calling it again
     * before the pause happens has no further effect.
     *
     * @throws NoActiveExecutionException if nothing is running; no checkpoint is written
     */
    public void stop() {
        Execution current = slot.current().orElse(null);
        if (current == null || !slot.isActive()) {
            throw new NoActiveExecutionException();
        }
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop requested for execution {}", current.getId());
        } else {
            log.debug("Stop already requested for execution {}", current.getId());
        }
    }

    /** Snapshot of the current execution, if any. A paused execution stays current until the next run. */
    public Optional<Execution> currentExecution() {
        return store.snapshot(slot);
    }

    public boolean isRunning() {
        return slot.isActive();
    }

    // ------------------------------------------------------------------
    // Resume point
    // ------------------------------------------------------------------

    /** First registry stage of the execution that is neither completed nor skipped. */
    ResumePoint resumePoint(Execution execution) {
        List<Stage> stages = registry.stages();
        for (int i = 0; i < stages.size(); i++) {
            String name = stages.get(i).definition().name();
            Optional<StageResult> r = execution.stage(name);
            if (r.isPresent() && r.get().getStatus().isSettled()) {
                continue;
            }
            ResumePoint.Recovery recovery = ResumePoint.Recovery.NONE;
            if (r.isPresent()) {
                StageStatus status = r.get().getStatus();
                if (status == StageStatus.RUNNING && r.get().hasData()) {
                    recovery = ResumePoint.Recovery.RESTORED;
                } else if (status == StageStatus.RUNNING || status == StageStatus.FAILED) {
                    recovery = ResumePoint.Recovery.FRESH;
                }
            }
            return new ResumePoint(name, i, recovery);
        }
        return new ResumePoint(null, stages.size(), ResumePoint.Recovery.NONE);
    }

    // ------------------------------------------------------------------
    // Run loop
    // ------------------------------------------------------------------

    private Execution drive(Execution execution, int startIndex) {
        MDC.put("executionId", execution.getId());
        try {
            List<Stage> stages = registry.stages();
            for (int i = startIndex; i < stages.size(); i++) {
                Stage stage = stages.get(i);
                String name = stage.definition().name();

                // A resumed run may pass stages that settled after an earlier CONTINUE failure.
                if (execution.stage(name).map(r -> r.getStatus().isSettled()).orElse(false)) {
                    log.debug("Stage '{}' already settled, not running it again", name);
                    continue;
                }
                if (stopRequested.get()) {
                    return pause(execution, name, "Stopped by operator before stage '" + name + "'");
                }

                MDC.put("stage", name);
                JsonNode data;
                try {
                    data = runStage(execution, stage);
                } catch (StageInterruptedException e) {
                    return pause(execution, name, "Stopped by operator during stage '" + name + "'");
                } catch (StageFailure e) {
                    store.failStage(execution, name, e.getMessage());
                    publish(PipelineEvent.stageFailed(execution.getId(), name, e.getMessage(), clock.instant()));
                    memory.rememberWorking("failure", JsonNodeFactory.instance.objectNode()
                            .put("summary", "Stage " + name + " failed: " + e.getMessage()), 7);
                    if (stage.definition().policy() == StagePolicy.ABORT) {
                        log.error("Stage '{}' failed, aborting: {}", name, e.getMessage());
                        return fail(execution, name, "Stage '" + name + "' failed: " + e.getMessage());
                    }
                    log.warn("Stage '{}' failed, continuing: {}", name, e.getMessage());
                    continue;
                } finally {
                    MDC.remove("stage");
                }

                store.completeStage(execution, name, data);
                publish(PipelineEvent.progress(execution.getId(), name, "completed", data, clock.instant()));

                if (stage.endsPipeline(data)) {
                    return endEarly(execution, i);
                }
            }
            return complete(execution);
        } catch (RuntimeException e) {
            // Checkpoint I/O or an engine bug: nothing more can be recorded reliably.
            log.error("Execution {} aborted by unexpected error: {}", execution.getId(), e.getMessage(), e);
            slot.clear();
            memory.endRun(null, false);
            publish(PipelineEvent.error(execution.getId(), null, e.getMessage(), clock.instant()));
            throw e;
        } finally {
            MDC.remove("executionId");
        }
    }

    /**
     * Attempt a stage, retrying transient failures.
     *
     * @throws StageFailure              once attempts are exhausted or the failure is permanent
     * @throws StageInterruptedException if a stop was observed
     */
    private JsonNode runStage(Execution execution, Stage stage) {
        String name      = stage.definition().name();
        String entityKey = ResearchRequest.normalize(execution.getEntity());
        ResearchRequest request = ResearchRequest.parse(execution.getInput());

        for (int attempt = 1; ; attempt++) {
            store.startStage(execution, name);
            publish(PipelineEvent.progress(execution.getId(), name, "running", null, clock.instant()));

            ContextBundle context = contextBuilder.build(entityKey, name, execution);
            StageContext ctx = new StageContext(
                    execution.getId(), name, request, execution.completedData(), context,
                    stopRequested::get,
                    partial -> store.savePartialResult(execution, name, partial),
                    memory::rememberWorking);

            long started = System.nanoTime();
            try {
                JsonNode result = registry.execute(stage, ctx);
                recordOutcome(entityKey, name, true, started, execution);
                log.info("Stage '{}' completed (attempt {})", name, attempt);
                return result;
            } catch (StageFailure e) {
                recordOutcome(entityKey, name, false, started, execution);
                if (!e.isRetryable() || attempt >= maxStageAttempts) {
                    throw e;
                }
                if (stopRequested.get()) {
                    throw new StageInterruptedException(name);
                }
                log.warn("Stage '{}' attempt {}/{} failed, retrying: {}",
                        name, attempt, maxStageAttempts, e.getMessage());
                publish(PipelineEvent.log(execution.getId(), name,
                        "Retrying stage '%s' after transient failure (attempt %d/%d)"
                                .formatted(name, attempt + 1, maxStageAttempts),
                        null, clock.instant()));
            }
        }
    }

    // ------------------------------------------------------------------
    // Endings
    // ------------------------------------------------------------------

    private Execution pause(Execution execution, String stage, String reason) {
        store.pauseExecution(slot, reason);
        memory.endRun(execution.getEntity(), false);
        publish(PipelineEvent.paused(execution.getId(), stage, reason, clock.instant()));
        return execution;
    }

    /** Stage {@code index} ended the pipeline; every later stage is skipped. */
    private Execution endEarly(Execution execution, int index) {
        List<Stage> stages = registry.stages();
        String by = stages.get(index).definition().name();
        for (int i = index + 1; i < stages.size(); i++) {
            store.skipStage(execution, stages.get(i).definition().name(), "Pipeline ended by stage '" + by + "'");
        }
        publish(PipelineEvent.log(execution.getId(), by,
                "Stage '" + by + "' ended the pipeline early", null, clock.instant()));
        return complete(execution);
    }

    private Execution complete(Execution execution) {
        store.completeExecution(execution);
        learn(execution);
        slot.clear();

        ObjectNode summary = JsonNodeFactory.instance.objectNode();
        summary.put("entity", execution.getEntity());
        ObjectNode stages = summary.putObject("stages");
        execution.completedData().forEach(stages::set);
        publish(PipelineEvent.result(execution.getId(), summary, clock.instant()));
        log.info("Execution {} completed", execution.getId());
        return execution;
    }

    private Execution fail(Execution execution, String stage, String error) {
        store.failExecution(execution, error);
        learn(execution);
        slot.clear();
        publish(PipelineEvent.error(execution.getId(), stage, error, clock.instant()));
        return execution;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Fold a finished run into long-term memory and promote its notable working entries.
     * The execution is already final on disk, so a memory write failure is logged rather
     * than propagated.
     */
    private void learn(Execution execution) {
        String entityKey = ResearchRequest.normalize(execution.getEntity());
        try {
            memory.rememberLongTerm(entityKey, execution.getEntity(),
                    FactExtractor.fromExecution(execution, clock.instant()));
            memory.recordAnalysis(entityKey, execution.getEntity());
            memory.endRun(entityKey, true);
        } catch (StoreException e) {
            log.error("Could not update long-term memory for '{}': {}", entityKey, e.getMessage(), e);
            memory.endRun(null, false);
        }
    }

    private void recordOutcome(String entityKey, String stage, boolean success, long startedNanos,
                               Execution execution) {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        String sizeHint = execution.stage("discovery")
                .map(StageResult::getData)
                .map(d -> d.path("size").asText(null))
                .orElse(null);
        try {
            memory.recordOutcome(entityKey, stage,
                    success ? StageOutcome.success(millis, sizeHint) : StageOutcome.failure(millis, sizeHint));
        } catch (StoreException e) {
            log.warn("Could not record outcome of stage '{}': {}", stage, e.getMessage());
        }
    }

    private void ensureIdle() {
        if (slot.isActive()) {
            throw new ExecutionAlreadyRunningException(slot.current().map(Execution::getId).orElse(null));
        }
    }

    private void publish(PipelineEvent event) {
        events.publish(event);
    }

    private static ObjectNode recoveryData(String mode) {
        return JsonNodeFactory.instance.objectNode().put("recovery", mode);
    }
}
