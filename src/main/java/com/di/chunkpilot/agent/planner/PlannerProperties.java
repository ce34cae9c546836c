package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.worker.BackendType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Planner policy constants. These are tuned empirically; the defaults are documented in DESIGN.md.
 */
@Validated
@ConfigurationProperties(prefix = "chunkpilot.planner")
public class PlannerProperties {

    @DecimalMin(value = "0.0", inclusive = false)
    private double targetChunkSeconds = 0.2;
    /** Minimum estimated speedup for going parallel; absorbs measurement noise. */
    @DecimalMin("1.0")
    private double minSpeedup = 1.2;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double memoryFraction = 0.8;
    /** CV above which batches are shrunk and adaptation flagged. */
    @DecimalMin("0.0")
    private double variabilityThreshold = 0.5;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double advisorConfidenceThreshold = 0.7;
    /** Warn when all results together need more than this share of available memory. */
    @DecimalMin("0.0")
    private double resultMemoryWarningFraction = 0.5;
    @Min(0)
    private long threadWorkerBaseBytes = 1L << 20;
    @Min(0)
    private long childJvmWorkerBaseBytes = 64L << 20;
    /** Items a single-pass input of unknown length is planned for. */
    @Min(1)
    private long unknownSizeHorizonItems = 10_000;
    private BackendType preferredBackend;

    public double getTargetChunkSeconds() {
        return targetChunkSeconds;
    }

    public void setTargetChunkSeconds(double targetChunkSeconds) {
        this.targetChunkSeconds = targetChunkSeconds;
    }

    public double getMinSpeedup() {
        return minSpeedup;
    }

    public void setMinSpeedup(double minSpeedup) {
        this.minSpeedup = minSpeedup;
    }

    public double getMemoryFraction() {
        return memoryFraction;
    }

    public void setMemoryFraction(double memoryFraction) {
        this.memoryFraction = memoryFraction;
    }

    public double getVariabilityThreshold() {
        return variabilityThreshold;
    }

    public void setVariabilityThreshold(double variabilityThreshold) {
        this.variabilityThreshold = variabilityThreshold;
    }

    public double getAdvisorConfidenceThreshold() {
        return advisorConfidenceThreshold;
    }

    public void setAdvisorConfidenceThreshold(double advisorConfidenceThreshold) {
        this.advisorConfidenceThreshold = advisorConfidenceThreshold;
    }

    public double getResultMemoryWarningFraction() {
        return resultMemoryWarningFraction;
    }

    public void setResultMemoryWarningFraction(double resultMemoryWarningFraction) {
        this.resultMemoryWarningFraction = resultMemoryWarningFraction;
    }

    public long getThreadWorkerBaseBytes() {
        return threadWorkerBaseBytes;
    }

    public void setThreadWorkerBaseBytes(long threadWorkerBaseBytes) {
        this.threadWorkerBaseBytes = threadWorkerBaseBytes;
    }

    public long getChildJvmWorkerBaseBytes() {
        return childJvmWorkerBaseBytes;
    }

    public void setChildJvmWorkerBaseBytes(long childJvmWorkerBaseBytes) {
        this.childJvmWorkerBaseBytes = childJvmWorkerBaseBytes;
    }

    public long getUnknownSizeHorizonItems() {
        return unknownSizeHorizonItems;
    }

    public void setUnknownSizeHorizonItems(long unknownSizeHorizonItems) {
        this.unknownSizeHorizonItems = unknownSizeHorizonItems;
    }

    public BackendType getPreferredBackend() {
        return preferredBackend;
    }

    public void setPreferredBackend(BackendType preferredBackend) {
        this.preferredBackend = preferredBackend;
    }
}
