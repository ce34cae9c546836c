package com.di.chunkpilot.worker;

/**
 * Execution backend chosen once by the planner.
 */
public enum BackendType {
    /** Workers behind a serialization boundary (in-JVM copy or child JVM). Compute-bound and mixed work. */
    ISOLATED_WORKER,
    /** Threads sharing the caller's heap. Wait-bound work, no transfer cost. */
    SHARED_MEMORY_WORKER
}
