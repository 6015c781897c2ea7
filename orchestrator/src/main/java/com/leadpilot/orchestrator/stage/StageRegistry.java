package com.leadpilot.orchestrator.stage;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ordered, named sequence of pipeline stages.
 *
 * All {@link Stage} beans are collected at startup via constructor injection and
 * sorted by {@link StageDefinition#order()}. Adding a stage only requires
 * declaring it as a {@code @Component}.
 *
 * <p>{@link #execute} is the stage boundary: every invocation is timed and
 * counted, and any exception a stage throws is converted into a
 * {@link StageFailure} carrying the original message. Only
 * {@link StageInterruptedException} passes through unchanged.
 */
@Component
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final List<Stage>   stages;
    private final MeterRegistry meterRegistry;

    public StageRegistry(List<Stage> allStages, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.stages = allStages.stream()
                .sorted(Comparator.comparingInt((Stage s) -> s.definition().order()))
                .toList();
        long distinct = stages.stream().map(s -> s.definition().name()).distinct().count();
        if (distinct != stages.size()) {
            throw new IllegalStateException("Duplicate stage names in " + stageNames());
        }
        for (Stage s : stages) {
            log.info("Registered stage #{} '{}' [{}] - {}",
                    s.definition().order(), s.definition().name(),
                    s.definition().policy(), s.definition().description());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public List<Stage> stages() {
        return stages;
    }

    /** Stage names in pipeline order. */
    public List<String> stageNames() {
        return stages.stream().map(s -> s.definition().name()).toList();
    }

    public Stage get(String name) {
        return stages.stream()
                .filter(s -> s.definition().name().equals(name))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("Unknown stage: " + name));
    }

    public int indexOf(String name) {
        return stageNames().indexOf(name);
    }

    public int size() {
        return stages.size();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Run one stage with full observability.
     *
     * <pre>
     *   leadpilot.stage.calls{stage, status="success|interrupted|provider_error|llm_error|parse_error|unexpected"}
     *   leadpilot.stage.duration{stage}
     * </pre>
     *
     * @throws StageFailure              on any failure inside the stage
     * @throws StageInterruptedException if the stage observed a stop request
     */
    public JsonNode execute(Stage stage, StageContext ctx) {
        String name = stage.definition().name();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            JsonNode result = stage.execute(ctx);
            if (result == null) {
                throw new StageFailure(StageFailure.Kind.PARSE_ERROR,
                        "Stage '" + name + "' returned no result");
            }
            return result;
        } catch (StageInterruptedException e) {
            status = "interrupted";
            throw e;
        } catch (StageFailure e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            StageFailure.Kind kind = StageFailure.Kind.UNEXPECTED;
            boolean retryable = false;
            if (e instanceof TransientFailure t) {
                kind      = t.failureKind();
                retryable = t.isTransient();
            }
            status = kind.name().toLowerCase();
            throw new StageFailure(kind,
                    "Stage '" + name + "' failed: " + e.getMessage(), retryable, e);
        } finally {
            sample.stop(meterRegistry.timer("leadpilot.stage.duration", "stage", name));
            meterRegistry.counter("leadpilot.stage.calls", "stage", name, "status", status).increment();
        }
    }
}
