package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;

import java.time.Instant;

/**
 * Flat, persistable form of a {@link Decision}. Serialized as JSON by {@link DecisionRecordCodec}.
 */
public record DecisionRecord(
        int workerCount,
        int batchSize,
        BackendType backend,
        WorkerCreationStrategy creationStrategy,
        double estimatedSpeedup,
        boolean adaptiveChunking,
        String provenance,
        int schemaVersion,
        Instant createdAt) {

    public static final int SCHEMA_VERSION = 1;
}
