package com.di.chunkpilot.agent.planner;

/**
 * Identity of a cached decision: same function, same dataset size, same planning constraints,
 * same record schema.
 */
public record DecisionCacheKey(String functionId, long datasetSize, String constraintsFingerprint,
                               int schemaVersion) {

    public static DecisionCacheKey of(String functionId, long datasetSize, PlanningConstraints constraints) {
        return new DecisionCacheKey(functionId, datasetSize, constraints.fingerprint(), DecisionRecord.SCHEMA_VERSION);
    }
}
