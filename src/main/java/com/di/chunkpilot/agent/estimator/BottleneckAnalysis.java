package com.di.chunkpilot.agent.estimator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BottleneckAnalysis {
    Bottleneck primary;
    /** 0..1, share of parallel time (or ratio) attributable to the primary bottleneck. */
    double severity;
    /** Other bottlenecks found, most severe first. */
    @Singular
    Map<Bottleneck, Double> contributingFactors;
    /** Percent of predicted parallel time per component: computation, spawn, transfer, dispatch. */
    @Singular("overhead")
    Map<String, Double> overheadBreakdown;
    /** Speedup / min(workers, cores), clamped to [0, 1]. */
    double efficiencyScore;
    @Singular
    List<String> recommendations;
}
