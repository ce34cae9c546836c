package com.di.chunkpilot.agent.sampler;

/**
 * Timing of one sampled item.
 *
 * @param itemIndex       position of the item in the dataset
 * @param wallTimeSeconds elapsed wall-clock time
 * @param busyTimeSeconds CPU time of the executing thread
 */
public record ItemTiming(int itemIndex, double wallTimeSeconds, double busyTimeSeconds) {

    /** Busy / wall, clamped to [0, 1]; 1.0 for an instantaneous item. */
    public double cpuRatio() {
        if (wallTimeSeconds <= 0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, busyTimeSeconds / wallTimeSeconds));
    }
}
