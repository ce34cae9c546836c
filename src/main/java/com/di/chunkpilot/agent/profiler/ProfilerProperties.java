package com.di.chunkpilot.agent.profiler;

import com.di.chunkpilot.worker.WorkerCreationStrategy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Profiler cache lifetimes and measurement limits.
 */
@Validated
@ConfigurationProperties(prefix = "chunkpilot.profiler")
public class ProfilerProperties {

    /** How long a measured worker creation cost stays valid. */
    @NotNull
    private Duration spawnCostTtl = Duration.ofMinutes(10);
    /** Memory changes fast; keep this short (0.1s to 60s). */
    @NotNull
    private Duration memoryTtl = Duration.ofSeconds(1);
    @NotNull
    private Duration spawnTimeout = Duration.ofSeconds(10);
    @DecimalMin("0.0")
    private double dispatchOverheadSeconds = 0.0005;
    @NotNull
    private WorkerCreationStrategy defaultStrategy = WorkerCreationStrategy.PLATFORM_THREAD;
    @Min(1)
    private int spawnCacheMaxSize = 16;

    public Duration getSpawnCostTtl() {
        return spawnCostTtl;
    }

    public void setSpawnCostTtl(Duration spawnCostTtl) {
        this.spawnCostTtl = spawnCostTtl;
    }

    public Duration getMemoryTtl() {
        return memoryTtl;
    }

    public void setMemoryTtl(Duration memoryTtl) {
        this.memoryTtl = memoryTtl;
    }

    public Duration getSpawnTimeout() {
        return spawnTimeout;
    }

    public void setSpawnTimeout(Duration spawnTimeout) {
        this.spawnTimeout = spawnTimeout;
    }

    public double getDispatchOverheadSeconds() {
        return dispatchOverheadSeconds;
    }

    public void setDispatchOverheadSeconds(double dispatchOverheadSeconds) {
        this.dispatchOverheadSeconds = dispatchOverheadSeconds;
    }

    public WorkerCreationStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(WorkerCreationStrategy defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    public int getSpawnCacheMaxSize() {
        return spawnCacheMaxSize;
    }

    public void setSpawnCacheMaxSize(int spawnCacheMaxSize) {
        this.spawnCacheMaxSize = spawnCacheMaxSize;
    }
}
