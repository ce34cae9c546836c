package com.di.chunkpilot.agent.adaptive;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for controllers built from planner decisions.
 */
@Validated
@ConfigurationProperties(prefix = "chunkpilot.adaptive")
public class AdaptiveProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double adaptationRate = 0.3;
    @Min(1)
    private int windowSize = 10;
    @Min(1)
    private int minSamples = 3;
    @DecimalMin("0.0")
    private double tolerance = 0.2;
    @Min(1)
    private int minBatch = 1;
    /** maxBatch = initial batch size times this when adaptation is on. */
    @Min(1)
    private int maxBatchGrowthFactor = 4;
    /** Adapt even when the planner did not flag variability. */
    private boolean alwaysAdapt = false;
    /** Batches in flight per worker; 1 keeps measured durations free of queueing time. */
    @Min(1)
    private int inFlightPerWorker = 1;

    public double getAdaptationRate() {
        return adaptationRate;
    }

    public void setAdaptationRate(double adaptationRate) {
        this.adaptationRate = adaptationRate;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public int getMinBatch() {
        return minBatch;
    }

    public void setMinBatch(int minBatch) {
        this.minBatch = minBatch;
    }

    public int getMaxBatchGrowthFactor() {
        return maxBatchGrowthFactor;
    }

    public void setMaxBatchGrowthFactor(int maxBatchGrowthFactor) {
        this.maxBatchGrowthFactor = maxBatchGrowthFactor;
    }

    public boolean isAlwaysAdapt() {
        return alwaysAdapt;
    }

    public void setAlwaysAdapt(boolean alwaysAdapt) {
        this.alwaysAdapt = alwaysAdapt;
    }

    public int getInFlightPerWorker() {
        return inFlightPerWorker;
    }

    public void setInFlightPerWorker(int inFlightPerWorker) {
        this.inFlightPerWorker = inFlightPerWorker;
    }
}
