package com.leadpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpilot.orchestrator.memory.EntityMemory;
import com.leadpilot.orchestrator.memory.PatternStats;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.repository.JsonFileStore;
import com.leadpilot.orchestrator.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Persistence wiring. Everything durable lives under {@code leadpilot.data-dir}:
 *
 * <pre>
 *   executions/           one checkpoint per execution id
 *   memory/long-term/     one record per entity
 *   memory/patterns/      one record per (stage, size bucket)
 * </pre>
 */
@Configuration
@EnableScheduling
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private final Path dataDir;

    public EngineConfig(@Value("${leadpilot.data-dir:./data}") String dataDir) {
        this.dataDir = Path.of(dataDir).toAbsolutePath().normalize();
        log.info("Data directory: {}", this.dataDir);
    }

    @Bean
    public KeyValueStore<Execution> executionStore(ObjectMapper objectMapper) {
        return new JsonFileStore<>(dataDir.resolve("executions"), Execution.class, objectMapper);
    }

    @Bean
    public KeyValueStore<EntityMemory> longTermMemoryStore(ObjectMapper objectMapper) {
        return new JsonFileStore<>(dataDir.resolve("memory").resolve("long-term"), EntityMemory.class, objectMapper);
    }

    @Bean
    public KeyValueStore<PatternStats> patternStore(ObjectMapper objectMapper) {
        return new JsonFileStore<>(dataDir.resolve("memory").resolve("patterns"), PatternStats.class, objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
