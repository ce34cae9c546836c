package com.di.chunkpilot.agent.adaptive;

import com.di.chunkpilot.agent.planner.Decision;
import com.di.chunkpilot.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Seeds adaptive controllers from planner decisions with the configured adaptation defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptiveChunkControllerFactory {

    private final AdaptiveProperties properties;
    private final MetricsCollector metricsCollector;

    public AdaptiveChunkController fromDecision(Decision decision) {
        return create(settingsFor(decision));
    }

    public AdaptiveChunkController create(AdaptiveSettings settings) {
        return new AdaptiveChunkController(settings, metricsCollector);
    }

    /**
     * Adaptation is on when the planner flagged variability (or always, when configured); the
     * batch may then grow to {@code maxBatchGrowthFactor} times the planned size.
     */
    public AdaptiveSettings settingsFor(Decision decision) {
        boolean enabled = decision.isAdaptiveChunking() || properties.isAlwaysAdapt();
        int batch = Math.max(1, decision.getBatchSize());
        int minBatch = Math.min(properties.getMinBatch(), batch);
        int maxBatch = enabled
                ? (int) Math.min(Integer.MAX_VALUE, (long) batch * properties.getMaxBatchGrowthFactor())
                : Integer.MAX_VALUE;
        AdaptiveSettings settings = AdaptiveSettings.builder()
                .workerCount(Math.max(1, decision.getWorkerCount()))
                .initialBatchSize(batch)
                .targetChunkSeconds(decision.getTargetChunkSeconds() > 0 ? decision.getTargetChunkSeconds() : 0.2)
                .adaptationRate(properties.getAdaptationRate())
                .minBatch(minBatch)
                .maxBatch(maxBatch)
                .windowSize(properties.getWindowSize())
                .minSamples(properties.getMinSamples())
                .tolerance(properties.getTolerance())
                .enabled(enabled)
                .backend(decision.getBackend())
                .creationStrategy(decision.getCreationStrategy())
                .maxInFlight(Math.max(1, decision.getWorkerCount()) * properties.getInFlightPerWorker())
                .build();
        log.debug("[ADAPTIVE] settings from {} decision: {}", decision.getReason(), settings);
        return settings;
    }
}
