package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call planning inputs. Nullable fields mean "no preference / detect".
 * Use {@link PlannerService#defaultConstraints()} for a builder seeded from configuration.
 */
@Value
@Builder(toBuilder = true)
public class PlanningConstraints {
    @Builder.Default
    double targetChunkSeconds = 0.2;
    @Builder.Default
    double minSpeedup = 1.2;
    /** Share of available memory the workers may use together. */
    @Builder.Default
    double memoryFraction = 0.8;
    @Builder.Default
    double variabilityThreshold = 0.5;
    /** Caller wants the runtime controller to adapt batch sizes. */
    @Builder.Default
    boolean adaptive = true;
    @Builder.Default
    double advisorConfidenceThreshold = 0.7;
    /** Items to sample; the sampler's configured size when null. */
    Integer sampleSize;
    /** Overrides backend classification. */
    BackendType preferredBackend;
    WorkerCreationStrategy creationStrategy;
    /** Threads the function uses internally; detected when null. */
    Integer internalThreads;
    Integer maxWorkers;
    /** Item count of a single-pass dataset; when null its size is treated as unknown. */
    Long expectedItemCount;
    /**
     * Cache identity of the function. Defaults to its class name when the function holds no
     * state; functions with captured state are only cached under an explicit id.
     */
    String functionId;

    /** The inputs that shape a plan besides function and size, as part of a cache key. */
    public String fingerprint() {
        return String.join("|",
                "target=" + targetChunkSeconds,
                "minSpeedup=" + minSpeedup,
                "memory=" + memoryFraction,
                "cv=" + variabilityThreshold,
                "adaptive=" + adaptive,
                "sample=" + sampleSize,
                "backend=" + preferredBackend,
                "strategy=" + creationStrategy,
                "threads=" + internalThreads,
                "maxWorkers=" + maxWorkers);
    }
}
