package com.leadpilot.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;

/**
 * Running outcome statistics for one (stage, size bucket) pair.
 *
 * Used only to bias future runs through context hints; nothing correctness
 * critical reads it.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class PatternStats {

    private String     stage;
    private SizeBucket bucket;
    private long       successes;
    private long       failures;
    private long       totalLatencyMillis;
    private Instant    updatedAt;

    protected PatternStats() {}   // required by Jackson

    public PatternStats(String stage, SizeBucket bucket) {
        this.stage  = stage;
        this.bucket = bucket;
    }

    public static String keyOf(String stage, SizeBucket bucket) {
        return stage + ":" + bucket.key();
    }

    public String     getStage()     { return stage; }
    public SizeBucket getBucket()    { return bucket; }
    public long       getSuccesses() { return successes; }
    public long       getFailures()  { return failures; }
    public Instant    getUpdatedAt() { return updatedAt; }

    public String key() {
        return keyOf(stage, bucket);
    }

    public void record(StageOutcome outcome, Instant now) {
        if (outcome.success()) {
            successes++;
        } else {
            failures++;
        }
        totalLatencyMillis += Math.max(0, outcome.latencyMillis());
        updatedAt = now;
    }

    public long samples() {
        return successes + failures;
    }

    public double failureRate() {
        return samples() == 0 ? 0.0 : (double) failures / samples();
    }

    public long averageLatencyMillis() {
        return samples() == 0 ? 0 : totalLatencyMillis / samples();
    }

    /** e.g. "roles for large companies: 12 runs, 25% failed, avg 3400 ms" */
    public String describe() {
        return "%s for %s: %d runs, %d%% failed, avg %d ms".formatted(
                stage, bucket.label(), samples(), Math.round(failureRate() * 100), averageLatencyMillis());
    }
}
