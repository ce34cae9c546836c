package com.di.chunkpilot.agent.planner;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON-in-memory implementation of {@link DecisionRecordStore}. Suitable for single-node and testing.
 * Enabled with {@code chunkpilot.persistence.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "chunkpilot.persistence.enabled", havingValue = "true")
public class InMemoryDecisionRecordStore implements DecisionRecordStore {

    private final DecisionRecordCodec codec;
    private final Map<DecisionCacheKey, String> byKey = new ConcurrentHashMap<>();

    @Override
    public Optional<DecisionRecord> load(DecisionCacheKey key) {
        String json = byKey.get(key);
        return json == null ? Optional.empty() : Optional.of(codec.decode(json));
    }

    @Override
    public void save(DecisionCacheKey key, DecisionRecord record) {
        byKey.put(key, codec.encode(record));
    }

    int size() {
        return byKey.size();
    }
}
