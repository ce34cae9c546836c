package com.di.chunkpilot.agent.planner;

/**
 * Machine-checkable reason attached to every decision. Each degradation branch of the planner
 * has its own code.
 */
public enum DecisionReason {
    EMPTY_DATASET,
    SAMPLING_FAILED,
    NOT_TRANSFERABLE,
    WORKLOAD_TOO_SMALL,
    MEMORY_CONSTRAINED,
    SERIAL_OPTIMAL,
    PARALLEL_BENEFICIAL,
    /** Taken from an external advisor hint without measuring. */
    ADVISOR,
    /** Served from the decision cache. */
    CACHED,
    /** Rebuilt from a persisted record. */
    RESTORED
}
