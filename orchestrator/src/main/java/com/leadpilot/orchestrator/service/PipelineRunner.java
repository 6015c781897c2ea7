package com.leadpilot.orchestrator.service;

import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Puts pipeline runs on a single background worker thread.
 *
 * Operator commands arrive on request threads. They are validated here,
 * synchronously, so the caller gets a 404/409 straight away; the run itself
 * is then handed to the worker and progress is reported through events.
 *
 * Also owns the housekeeping around runs: startup report of executions that
 * a crash left RUNNING, periodic purge of old completed checkpoints, and a
 * graceful stop on shutdown.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "pipeline-worker");
        t.setDaemon(false);
        return t;
    });

    private final PipelineOrchestrator orchestrator;
    private final ExecutionStateStore  store;
    private final Clock                clock;
    private final Duration             retention;

    private Future<?> inFlight;

    public PipelineRunner(PipelineOrchestrator orchestrator,
                          ExecutionStateStore store,
                          Clock clock,
                          @Value("${leadpilot.retention.completed-days:30}") int retentionDays) {
        this.orchestrator = orchestrator;
        this.store        = store;
        this.clock        = clock;
        this.retention    = Duration.ofDays(retentionDays);
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Create an execution and start it in the background.
     *
     * @return the new execution, still PENDING when this returns
     * @throws ExecutionAlreadyRunningException if a run is in flight
     * @throws IllegalArgumentException         if the input does not name a company
     */
    public synchronized Execution submit(String input) {
        ensureIdle();
        Execution execution = store.create(input);
        dispatch(execution.getId(), () -> orchestrator.run(execution));
        return execution;
    }

    /**
     * Resume an execution in the background.
     *
     * @param reference execution id, or N for the N-th resumable execution
     * @return the resolved execution id
     * @throws ExecutionNotFoundException       if nothing matches the reference
     * @throws AlreadyCompletedException        if the execution is completed
     * @throws ExecutionAlreadyRunningException if a run is in flight
     */
    public synchronized String resume(String reference) {
        ensureIdle();
        String id = store.resolveReference(reference);
        Execution execution = store.find(id).orElseThrow(() -> new ExecutionNotFoundException(id));
        if (execution.isTerminal()) {
            throw new AlreadyCompletedException(id);
        }
        dispatch(id, () -> orchestrator.resume(id));
        return id;
    }

    /** @throws NoActiveExecutionException if nothing is running */
    public void stop() {
        orchestrator.stop();
    }

    public synchronized boolean isBusy() {
        return (inFlight != null && !inFlight.isDone()) || orchestrator.isRunning();
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /** Executions still RUNNING on disk at startup were cut off by a crash or kill. */
    @EventListener(ApplicationReadyEvent.class)
    public void reportUngracefulExits() {
        List<Execution> orphaned = store.listResumable().stream()
                .filter(e -> e.getStatus() == ExecutionStatus.RUNNING)
                .toList();
        for (Execution e : orphaned) {
            log.warn("Execution {} ('{}') was interrupted without a clean pause; resume it with 'resume {}'",
                    e.getId(), e.getEntity(), e.getId());
        }
    }

    @Scheduled(cron = "${leadpilot.retention.purge-cron:0 0 3 * * *}")
    public void purgeCompleted() {
        Instant cutoff = clock.instant().minus(retention);
        store.purgeCompletedBefore(cutoff);
    }

    /** Ask a running execution to pause and give it time to reach a safe point. */
    @PreDestroy
    public void shutdown() {
        if (orchestrator.isRunning()) {
            try {
                orchestrator.stop();
            } catch (NoActiveExecutionException e) {
                log.debug("Run finished before shutdown stop: {}", e.getMessage());
            }
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Pipeline worker did not stop within {}s; the current execution stays resumable",
                        SHUTDOWN_GRACE_SECONDS);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ensureIdle() {
        if (isBusy()) {
            throw new ExecutionAlreadyRunningException(
                    orchestrator.currentExecution().map(Execution::getId).orElse(null));
        }
    }

    private void dispatch(String executionId, Runnable run) {
        inFlight = worker.submit(() -> {
            try {
                run.run();
            } catch (Exception e) {
                log.error("Unhandled error in pipeline run {}: {}", executionId, e.getMessage(), e);
            }
        });
    }
}
