package com.leadpilot.orchestrator.service;

import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    private static final Instant NOW = Instant.parse("2026-06-01T03:00:00Z");

    @Mock PipelineOrchestrator orchestrator;
    @Mock ExecutionStateStore  store;

    private PipelineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PipelineRunner(orchestrator, store, Clock.fixed(NOW, ZoneOffset.UTC), 30);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void submit_createsThenRunsOnWorkerThread() {
        Execution e = new Execution("e1", "Acme", "Acme", NOW);
        when(store.create("Acme")).thenReturn(e);

        Execution pending = runner.submit("Acme");

        assertThat(pending.getId()).isEqualTo("e1");
        verify(orchestrator, timeout(2000)).run(e);
    }

    @Test
    void submit_whileOrchestratorRunning_rejectedBeforeCreating() {
        when(orchestrator.isRunning()).thenReturn(true);
        when(orchestrator.currentExecution()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> runner.submit("Acme")).isInstanceOf(ExecutionAlreadyRunningException.class);
        verify(store, never()).create(any());
    }

    @Test
    void resume_completedExecution_rejectedWithoutDispatch() {
        Execution done = new Execution("e1", "Acme", "Acme", NOW);
        done.setStatus(ExecutionStatus.COMPLETED);
        when(store.resolveReference("1")).thenReturn("e1");
        when(store.find("e1")).thenReturn(Optional.of(done));

        assertThatThrownBy(() -> runner.resume("1")).isInstanceOf(AlreadyCompletedException.class);
        verify(orchestrator, never()).resume(any());
    }

    @Test
    void resume_pausedExecution_dispatchesResolvedId() {
        Execution paused = new Execution("e7", "Acme", "Acme", NOW);
        paused.setStatus(ExecutionStatus.PAUSED);
        when(store.resolveReference("e7")).thenReturn("e7");
        when(store.find("e7")).thenReturn(Optional.of(paused));

        assertThat(runner.resume("e7")).isEqualTo("e7");
        verify(orchestrator, timeout(2000)).resume("e7");
    }

    @Test
    void purgeCompleted_usesRetentionWindow() {
        runner.purgeCompleted();

        verify(store).purgeCompletedBefore(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    void reportUngracefulExits_onlyReadsStore() {
        Execution crashed = new Execution("e1", "Acme", "Acme", NOW);
        crashed.setStatus(ExecutionStatus.RUNNING);
        when(store.listResumable()).thenReturn(List.of(crashed));

        runner.reportUngracefulExits();

        verify(store).listResumable();
        verify(orchestrator, never()).resume(any());
    }
}
