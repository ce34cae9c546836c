package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.agent.estimator.Bottleneck;
import com.di.chunkpilot.agent.sampler.WorkloadClass;
import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured explanation of a decision for external reporting. Carries values only; rendering
 * and output channels are the caller's concern.
 */
@Value
@Builder
public class DiagnosticProfile {
    int physicalCores;
    int logicalCores;
    long availableMemoryBytes;
    WorkerCreationStrategy creationStrategy;
    double spawnCostSeconds;
    boolean spawnCostMeasured;
    double meanItemSeconds;
    double coefficientOfVariation;
    WorkloadClass workloadClass;
    BackendType backend;
    Bottleneck bottleneck;
    double bottleneckSeverity;
    double efficiencyScore;
    @Singular("overhead")
    Map<String, Double> overheadBreakdown;
    @Singular
    List<String> recommendations;

    /** Profile for decisions made without measuring (advisor, cache, restored records). */
    public static DiagnosticProfile unmeasured(BackendType backend) {
        return DiagnosticProfile.builder()
                .backend(backend)
                .bottleneck(Bottleneck.NONE)
                .build();
    }
}
