package com.leadpilot.orchestrator.repository;

import java.util.List;
import java.util.Optional;

/**
 * Durable load/save-by-key collection.
 *
 * The engine keeps three of them: executions keyed by id, long-term memory keyed
 * by entity, pattern statistics keyed by "stage:bucket".
 *
 * Implementations must make {@link #save} atomic: a reader (or a process that
 * crashed mid-write and restarted) sees either the previous value or the new one,
 * never a mix.
 */
public interface KeyValueStore<V> {

    Optional<V> load(String key);

    void save(String key, V value);

    /** @return true if a value existed and was removed */
    boolean delete(String key);

    /** All keys currently stored, in no particular order. */
    List<String> keys();

    /**
     * Every readable value. Entries that cannot be decoded are skipped, so
     * listing tolerates a store that another process is writing to.
     */
    List<V> loadAll();
}
