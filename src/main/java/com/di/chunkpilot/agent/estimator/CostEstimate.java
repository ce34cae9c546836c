package com.di.chunkpilot.agent.estimator;

import com.di.chunkpilot.worker.BackendType;
import lombok.Builder;
import lombok.Value;

/**
 * Evaluated candidate: predicted parallel time for one (workerCount, batchSize) pair and the
 * overhead terms that produced it. All times in seconds.
 */
@Value
@Builder
public class CostEstimate {
    int workerCount;
    int batchSize;
    BackendType backend;
    /** serial / parallel, capped at workerCount; exactly 1.0 for a single worker. */
    double estimatedSpeedup;
    double serialSeconds;
    double parallelSeconds;
    /** serial / workerCount. */
    double computeSeconds;
    double spawnOverheadSeconds;
    /** Serialization of items and results across the isolation boundary. */
    double transferOverheadSeconds;
    /** Fixed per-batch hand-off cost summed over all batches. */
    double dispatchOverheadSeconds;
    long batchCount;
    String rationale;

    /** transfer + dispatch. */
    public double getBatchingOverheadSeconds() {
        return transferOverheadSeconds + dispatchOverheadSeconds;
    }
}
