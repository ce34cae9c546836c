package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable planner output: how many workers, how items are grouped, on which backend, and why.
 */
@Value
@Builder(toBuilder = true)
public class Decision {
    int workerCount;
    int batchSize;
    BackendType backend;
    WorkerCreationStrategy creationStrategy;
    double estimatedSpeedup;
    DecisionReason reason;
    String explanation;
    /** Runtime controller should adapt batch size (high item-time variability). */
    boolean adaptiveChunking;
    /** Batch duration the adaptive controller should aim for, in seconds. */
    double targetChunkSeconds;
    @Singular
    List<String> warnings;
    DiagnosticProfile diagnostics;
    /** measured, advisor, cache or restored. */
    String provenance;
    Iterable<?> data;

    public boolean isSerial() {
        return workerCount <= 1;
    }

    /**
     * The dataset to execute over. For single-pass inputs this is the reconstructed sequence
     * (sampled head followed by the remainder); null for restored decisions.
     */
    @SuppressWarnings("unchecked")
    public <T> Iterable<T> getData() {
        return (Iterable<T>) data;
    }

    public DecisionRecord toRecord() {
        return new DecisionRecord(workerCount, batchSize, backend, creationStrategy, estimatedSpeedup,
                adaptiveChunking, provenance, DecisionRecord.SCHEMA_VERSION, Instant.now());
    }
}
