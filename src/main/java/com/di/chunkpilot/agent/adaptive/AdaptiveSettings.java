package com.di.chunkpilot.agent.adaptive;

import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.Builder;
import lombok.Value;

/**
 * Construction parameters of an {@link AdaptiveChunkController}. Validated by the controller.
 */
@Value
@Builder(toBuilder = true)
public class AdaptiveSettings {
    int workerCount;
    int initialBatchSize;
    @Builder.Default
    double targetChunkSeconds = 0.2;
    @Builder.Default
    double adaptationRate = 0.3;
    @Builder.Default
    int minBatch = 1;
    /** Unbounded by default. */
    @Builder.Default
    int maxBatch = Integer.MAX_VALUE;
    @Builder.Default
    int windowSize = 10;
    @Builder.Default
    int minSamples = 3;
    /** Relative deviation from the target tolerated before adapting. */
    @Builder.Default
    double tolerance = 0.2;
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    BackendType backend = BackendType.ISOLATED_WORKER;
    @Builder.Default
    WorkerCreationStrategy creationStrategy = WorkerCreationStrategy.PLATFORM_THREAD;
    /** Batches dispatched but not completed; {@code workerCount} when 0. */
    int maxInFlight;
}
