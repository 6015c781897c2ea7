package com.leadpilot.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionStatus;
import com.leadpilot.orchestrator.model.StageResult;
import com.leadpilot.orchestrator.model.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private JsonFileStore<Execution> store;

    @BeforeEach
    void setUp() {
        store = new JsonFileStore<>(dir.resolve("executions"), Execution.class,
                new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void save_thenLoad_returnsEqualRecord() {
        Execution e = new Execution("e1", "Acme, Roles: CEO", "Acme", T0);
        e.setStatus(ExecutionStatus.PAUSED);
        e.setError("Stopped by operator");
        StageResult r = e.stageOrCreate("enrichment");
        r.setStatus(StageStatus.RUNNING);
        r.setData(JsonNodeFactory.instance.objectNode().put("total_found", 3));
        r.incrementAttempts();

        store.save("e1", e);
        Execution loaded = store.load("e1").orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(loaded.getError()).isEqualTo("Stopped by operator");
        assertThat(loaded.getCreatedAt()).isEqualTo(T0);
        StageResult restored = loaded.stage("enrichment").orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(StageStatus.RUNNING);
        assertThat(restored.getData().path("total_found").asInt()).isEqualTo(3);
        assertThat(restored.getAttempts()).isEqualTo(1);
    }

    @Test
    void save_overwrite_leavesNoTempFiles() throws IOException {
        Execution e = new Execution("e1", "Acme", "Acme", T0);
        store.save("e1", e);
        e.setStatus(ExecutionStatus.COMPLETED);
        store.save("e1", e);

        assertThat(store.load("e1").orElseThrow().getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        try (Stream<Path> files = Files.list(store.directory())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("e1.json");
        }
    }

    @Test
    void keys_withSpacesAndSlashes_roundTripThroughFileNames() {
        store.save("acme / west coast", new Execution("x", "Acme", "Acme", T0));
        assertThat(store.keys()).containsExactly("acme / west coast");
        assertThat(store.load("acme / west coast")).isPresent();
    }

    @Test
    void load_missingKey_isEmpty() {
        assertThat(store.load("nope")).isEmpty();
        assertThat(store.keys()).isEmpty();
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void loadAll_skipsCorruptFilesAndIgnoresTempFiles() throws IOException {
        store.save("good", new Execution("good", "Acme", "Acme", T0));
        Files.writeString(store.directory().resolve("bad.json"), "{not json");
        Files.writeString(store.directory().resolve("good.json123.tmp"), "{}");

        assertThat(store.loadAll()).extracting(Execution::getId).containsExactly("good");
        assertThatThrownBy(() -> store.load("bad")).isInstanceOf(StoreException.class);
    }

    @Test
    void delete_removesFileAndReportsWhetherItExisted() {
        store.save("e1", new Execution("e1", "Acme", "Acme", T0));
        assertThat(store.delete("e1")).isTrue();
        assertThat(store.delete("e1")).isFalse();
        assertThat(store.load("e1")).isEmpty();
    }

    @Test
    void blankKey_rejected() {
        assertThatThrownBy(() -> store.load(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
