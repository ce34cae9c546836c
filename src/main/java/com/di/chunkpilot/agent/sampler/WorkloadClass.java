package com.di.chunkpilot.agent.sampler;

/**
 * How a unit of work spends its wall time, from the mean busy / wall ratio of the sample.
 */
public enum WorkloadClass {
    /** Ratio of at least 0.7: threads are busy computing. */
    COMPUTE_BOUND,
    /** Ratio below 0.3: mostly waiting on I/O, locks or sleeps. */
    WAIT_BOUND,
    MIXED;

    static final double COMPUTE_THRESHOLD = 0.7;
    static final double WAIT_THRESHOLD = 0.3;

    public static WorkloadClass fromCpuRatio(double ratio) {
        if (ratio >= COMPUTE_THRESHOLD) {
            return COMPUTE_BOUND;
        }
        if (ratio < WAIT_THRESHOLD) {
            return WAIT_BOUND;
        }
        return MIXED;
    }
}
