package com.di.chunkpilot.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for planning decisions and runtime batch adaptation.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Planning Metrics
    private final Timer planningTimer;
    private final DistributionSummary speedupDistribution;
    private final DistributionSummary workerCountDistribution;
    private final DistributionSummary batchSizeDistribution;

    // Profiler Metrics
    private final Counter spawnCostFallbackCounter;

    // Adaptive Controller Metrics
    private final Counter adaptationCounter;
    private final Timer batchDurationTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.planningTimer = Timer.builder("chunkpilot.planning.duration")
                .description("Time taken to produce a parallel execution decision")
                .register(meterRegistry);

        this.speedupDistribution = DistributionSummary.builder("chunkpilot.planning.speedup")
                .description("Distribution of estimated speedups of returned decisions")
                .register(meterRegistry);

        this.workerCountDistribution = DistributionSummary.builder("chunkpilot.planning.workers")
                .description("Distribution of decided worker counts")
                .register(meterRegistry);

        this.batchSizeDistribution = DistributionSummary.builder("chunkpilot.planning.batch.size")
                .description("Distribution of decided batch sizes")
                .baseUnit("items")
                .register(meterRegistry);

        this.spawnCostFallbackCounter = Counter.builder("chunkpilot.profiler.spawn.fallback")
                .description("Spawn cost measurements replaced by the static estimate")
                .register(meterRegistry);

        this.adaptationCounter = Counter.builder("chunkpilot.adaptive.adaptations")
                .description("Batch size adaptations performed by adaptive controllers")
                .register(meterRegistry);

        this.batchDurationTimer = Timer.builder("chunkpilot.adaptive.batch.duration")
                .description("Wall-clock duration of completed batches")
                .register(meterRegistry);
    }

    // ============================================================================
    // Planning Metrics
    // ============================================================================

    /**
     * Records a planning decision.
     *
     * @param reason     decision reason code (used as tag)
     * @param workers    decided worker count
     * @param batchSize  decided batch size
     * @param speedup    estimated speedup
     * @param durationMs time spent planning
     */
    public void recordDecision(String reason, int workers, int batchSize, double speedup, long durationMs) {
        Counter.builder("chunkpilot.planning.decisions")
                .description("Planning decisions by reason")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        planningTimer.record(durationMs, TimeUnit.MILLISECONDS);
        speedupDistribution.record(speedup);
        workerCountDistribution.record(workers);
        batchSizeDistribution.record(batchSize);
        log.debug("Recorded decision: reason={}, workers={}, batchSize={}, speedup={}, durationMs={}",
                reason, workers, batchSize, speedup, durationMs);
    }

    public void recordSpawnCostFallback() {
        spawnCostFallbackCounter.increment();
    }

    // ============================================================================
    // Adaptive Controller Metrics
    // ============================================================================

    public void recordBatchDuration(long durationNanos) {
        batchDurationTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordAdaptation() {
        adaptationCounter.increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
