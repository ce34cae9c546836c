package com.di.chunkpilot.agent.planner;

import java.util.Optional;

/**
 * Optional source of precomputed decisions (for example a model trained on past runs).
 * Implementations may throw; the planner then behaves as if no hint was given.
 */
public interface ExecutionAdvisor {

    /**
     * @param functionId  identity of the unit of work
     * @param datasetSize item count, or -1 when unknown
     */
    Optional<AdvisorHint> advise(String functionId, long datasetSize);
}
