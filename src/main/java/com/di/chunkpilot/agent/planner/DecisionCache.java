package com.di.chunkpilot.agent.planner;

import java.util.Optional;

/**
 * Result cache for decisions. A miss (or any exception) must behave exactly like having no cache.
 */
public interface DecisionCache {

    Optional<DecisionRecord> get(DecisionCacheKey key);

    void put(DecisionCacheKey key, DecisionRecord record);

    void invalidateAll();
}
