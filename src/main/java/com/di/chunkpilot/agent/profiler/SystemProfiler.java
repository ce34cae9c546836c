package com.di.chunkpilot.agent.profiler;

import com.di.chunkpilot.util.MdcPropagation;
import com.di.chunkpilot.util.MetricsCollector;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers "how many cores, how much memory, how expensive is a worker" for the planner.
 * Worker creation cost and available memory sit in process-wide Caffeine caches with
 * independent lifetimes; concurrent first callers share one in-flight measurement.
 */
@Slf4j
@Service
public class SystemProfiler {

    private static final String MEMORY_KEY = "available";

    private final ProfilerProperties properties;
    private final MetricsCollector metricsCollector;
    private final SpawnCostProbe spawnCostProbe;
    private final MemoryProbe memoryProbe;
    private final Cache<WorkerCreationStrategy, SpawnMeasurement> spawnCosts;
    private final Cache<String, Long> memory;

    @Autowired
    public SystemProfiler(ProfilerProperties properties, MetricsCollector metricsCollector) {
        this(properties, metricsCollector, SpawnCostProbe.defaultProbe(), new MemoryProbe(), Ticker.systemTicker());
    }

    /**
     * For callers supplying their own probes or clock (cache expiry follows {@code ticker}).
     */
    public SystemProfiler(ProfilerProperties properties, MetricsCollector metricsCollector,
                          SpawnCostProbe spawnCostProbe, MemoryProbe memoryProbe, Ticker ticker) {
        this.properties = properties;
        this.metricsCollector = metricsCollector;
        this.spawnCostProbe = spawnCostProbe;
        this.memoryProbe = memoryProbe;
        this.spawnCosts = Caffeine.newBuilder()
                .maximumSize(properties.getSpawnCacheMaxSize())
                .expireAfterWrite(properties.getSpawnCostTtl())
                .ticker(ticker)
                .build();
        this.memory = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(properties.getMemoryTtl())
                .ticker(ticker)
                .build();
    }

    /**
     * Full snapshot for the given creation strategy.
     */
    public SystemProfile profile(WorkerCreationStrategy strategy) {
        WorkerCreationStrategy effective = strategy != null ? strategy : properties.getDefaultStrategy();
        SpawnMeasurement spawn = spawnCost(effective);
        SystemProfile profile = SystemProfile.builder()
                .physicalCores(detectPhysicalCores())
                .logicalCores(detectLogicalCores())
                .availableMemoryBytes(detectMemory())
                .maxHeapBytes(SystemProbe.detectMaxHeapBytes())
                .creationStrategy(effective)
                .spawnCostSeconds(spawn.seconds())
                .spawnCostMeasured(spawn.measured())
                .dispatchOverheadSeconds(properties.getDispatchOverheadSeconds())
                .measuredAt(Instant.now())
                .build();
        log.debug("[PROFILER] cores={}/{} memoryBytes={} strategy={} spawnCost={}s measured={}",
                profile.getPhysicalCores(), profile.getLogicalCores(), profile.getAvailableMemoryBytes(),
                effective, String.format("%.6f", spawn.seconds()), spawn.measured());
        return profile;
    }

    public SystemProfile profile() {
        return profile(properties.getDefaultStrategy());
    }

    /**
     * Cached worker creation cost in seconds. Measured once per strategy per TTL.
     */
    public double getSpawnCost(WorkerCreationStrategy strategy) {
        return spawnCost(strategy).seconds();
    }

    private SpawnMeasurement spawnCost(WorkerCreationStrategy strategy) {
        return spawnCosts.get(strategy, s -> measureSpawnCost(s, properties.getSpawnTimeout()));
    }

    /**
     * Creates and tears down one worker, bounded by {@code timeout}. Timeouts, failures and
     * values outside the strategy's plausible range are replaced by the static estimate.
     */
    public SpawnMeasurement measureSpawnCost(WorkerCreationStrategy strategy, Duration timeout) {
        ExecutorService runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chunkpilot-spawn-measure");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<Double> measurement = runner.submit(MdcPropagation.wrapCallable(() -> spawnCostProbe.measureSeconds(strategy)));
            double seconds = measurement.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (strategy.isPlausible(seconds)) {
                log.info("[PROFILER] Measured {} worker creation cost {}s", strategy, String.format("%.6f", seconds));
                return new SpawnMeasurement(seconds, true);
            }
            log.warn("[PROFILER] Implausible {} creation cost {}s (bounds {}..{}); using estimate {}s",
                    strategy, seconds, strategy.getMinPlausibleSeconds(), strategy.getMaxPlausibleSeconds(),
                    strategy.getEstimateSeconds());
        } catch (TimeoutException e) {
            log.warn("[PROFILER] {} creation cost measurement timed out after {}; using estimate {}s",
                    strategy, timeout, strategy.getEstimateSeconds());
        } catch (ExecutionException e) {
            log.warn("[PROFILER] {} creation cost measurement failed: {}; using estimate {}s",
                    strategy, e.getCause() != null ? e.getCause().toString() : e.toString(),
                    strategy.getEstimateSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[PROFILER] Interrupted while measuring {} creation cost; using estimate", strategy);
        } finally {
            runner.shutdownNow();
        }
        metricsCollector.recordSpawnCostFallback();
        return new SpawnMeasurement(strategy.getEstimateSeconds(), false);
    }

    /**
     * Available memory in bytes: the tighter of host free memory and container headroom.
     */
    public long detectMemory() {
        return memory.get(MEMORY_KEY, k -> memoryProbe.availableBytes());
    }

    public int detectPhysicalCores() {
        return SystemProbe.detectPhysicalCores();
    }

    public int detectLogicalCores() {
        return SystemProbe.detectLogicalCores();
    }

    public void clearCaches() {
        spawnCosts.invalidateAll();
        memory.invalidateAll();
        log.debug("[PROFILER] caches cleared");
    }

    /** A creation cost and whether it was actually measured. */
    public record SpawnMeasurement(double seconds, boolean measured) {}
}
