package com.di.chunkpilot.agent.adaptive;

/**
 * Consistent snapshot of a controller, taken under its bookkeeping lock.
 */
public record AdaptiveStats(
        int currentBatchSize,
        long totalProcessed,
        long adaptationCount,
        double averageBatchSeconds,
        int windowDepth,
        int windowCapacity,
        int minBatch,
        int maxBatch,
        boolean enabled,
        AdaptiveChunkController.State state) {
}
