package com.di.chunkpilot.agent.planner;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded, expiring in-process {@link DecisionCache}. Stores flat records only, never datasets.
 */
public class CaffeineDecisionCache implements DecisionCache {

    private final Cache<DecisionCacheKey, DecisionRecord> records;

    public CaffeineDecisionCache(long maxSize, Duration expireAfterWrite) {
        this.records = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    @Override
    public Optional<DecisionRecord> get(DecisionCacheKey key) {
        if (key == null) return Optional.empty();
        DecisionRecord cached = records.getIfPresent(key);
        if (cached == null || cached.schemaVersion() != key.schemaVersion()) {
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    @Override
    public void put(DecisionCacheKey key, DecisionRecord record) {
        if (key != null && record != null) {
            records.put(key, record);
        }
    }

    @Override
    public void invalidateAll() {
        records.invalidateAll();
    }

    long size() {
        records.cleanUp();
        return records.estimatedSize();
    }
}
