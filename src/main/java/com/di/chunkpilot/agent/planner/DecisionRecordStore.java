package com.di.chunkpilot.agent.planner;

import java.util.Optional;

/**
 * Persistence for decision records. The planner only produces and accepts records; storage is the
 * implementation's business. Exceptions are treated as a miss.
 */
public interface DecisionRecordStore {

    Optional<DecisionRecord> load(DecisionCacheKey key);

    void save(DecisionCacheKey key, DecisionRecord record);
}
