package com.di.chunkpilot.agent.planner;

/**
 * Precomputed suggestion from an {@link ExecutionAdvisor}.
 *
 * @param confidence 0..1; the planner only accepts hints at or above its threshold
 */
public record AdvisorHint(int workerCount, int batchSize, double confidence) {
}
