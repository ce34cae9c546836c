package com.di.chunkpilot.agent.estimator;

/**
 * What limits the parallel speedup of a decision (for reporting and tuning).
 */
public enum Bottleneck {
    /** Creating the workers dominates. */
    SPAWN_OVERHEAD,
    /** Serializing items and results across the isolation boundary. */
    TRANSFER_OVERHEAD,
    /** Per-batch hand-off cost; batches are too small. */
    DISPATCH_OVERHEAD,
    /** Fewer workers than cores because memory runs out. */
    MEMORY_CONSTRAINT,
    /** Items finish in under a millisecond. */
    INSUFFICIENT_COMPUTATION,
    /** Less than a second of total work. */
    WORKLOAD_TOO_SMALL,
    /** Item durations vary widely. */
    HETEROGENEOUS_WORKLOAD,
    NONE
}
