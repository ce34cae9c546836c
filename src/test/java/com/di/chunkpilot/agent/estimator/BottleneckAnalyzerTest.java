package com.di.chunkpilot.agent.estimator;

import com.di.chunkpilot.worker.BackendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BottleneckAnalyzer Tests")
class BottleneckAnalyzerTest {

    private final BottleneckAnalyzer analyzer = new BottleneckAnalyzer();

    private static CostEstimate.CostEstimateBuilder estimate(int workers, double compute) {
        return CostEstimate.builder()
                .workerCount(workers)
                .batchSize(10)
                .backend(BackendType.ISOLATED_WORKER)
                .serialSeconds(compute * workers)
                .computeSeconds(compute)
                .batchCount(100);
    }

    @Test
    @DisplayName("Clean estimate has no bottleneck and high efficiency")
    void clean_noBottleneck() {
        CostEstimate e = estimate(8, 10.0).estimatedSpeedup(7.6).build();
        BottleneckAnalysis analysis = analyzer.analyze(e, 0.05, 0.1, 8, 8L << 30, 1 << 20);

        assertEquals(Bottleneck.NONE, analysis.getPrimary());
        assertEquals(0.95, analysis.getEfficiencyScore(), 1e-9);
        assertTrue(analysis.getRecommendations().get(0).startsWith("Excellent"));
        assertEquals(100.0, analysis.getOverheadBreakdown().get("computation"), 1e-9);
    }

    @Test
    @DisplayName("Spawn overhead above a fifth of parallel time is flagged")
    void spawnDominated() {
        CostEstimate e = estimate(8, 1.0).spawnOverheadSeconds(1.0).estimatedSpeedup(4.0).build();
        BottleneckAnalysis analysis = analyzer.analyze(e, 0.05, 0.0, 8, 8L << 30, 1 << 20);

        assertEquals(Bottleneck.SPAWN_OVERHEAD, analysis.getPrimary());
        assertEquals(0.5, analysis.getSeverity(), 1e-9);
        assertEquals(50.0, analysis.getOverheadBreakdown().get("spawn"), 1e-9);
    }

    @Test
    @DisplayName("Contributing factors are ranked below the primary")
    void multipleBottlenecks_ranked() {
        CostEstimate e = estimate(4, 1.0)
                .transferOverheadSeconds(1.0)
                .dispatchOverheadSeconds(0.5)
                .estimatedSpeedup(1.6)
                .build();
        BottleneckAnalysis analysis = analyzer.analyze(e, 0.01, 0.9, 8, 8L << 30, 1 << 20);

        // transfer 0.4, dispatch 0.2, heterogeneous 0.9
        assertEquals(Bottleneck.HETEROGENEOUS_WORKLOAD, analysis.getPrimary());
        assertEquals(0.4, analysis.getContributingFactors().get(Bottleneck.TRANSFER_OVERHEAD), 1e-9);
        assertEquals(0.2, analysis.getContributingFactors().get(Bottleneck.DISPATCH_OVERHEAD), 1e-9);
        assertEquals(3, analysis.getRecommendations().size());
    }

    @Test
    @DisplayName("Memory pressure below the core count is flagged")
    void memoryConstraint() {
        CostEstimate e = estimate(2, 10.0).estimatedSpeedup(2.0).build();
        BottleneckAnalysis analysis = analyzer.analyze(e, 0.05, 0.0, 8, 100, 40);

        assertEquals(Bottleneck.MEMORY_CONSTRAINT, analysis.getPrimary());
        assertEquals(0.8, analysis.getSeverity(), 1e-9);
    }

    @Test
    @DisplayName("Tiny items and tiny workloads are flagged")
    void tinyWork_flagged() {
        CostEstimate e = estimate(1, 0.05).estimatedSpeedup(1.0).build();
        BottleneckAnalysis analysis = analyzer.analyze(e, 0.0001, 0.0, 8, 8L << 30, 1 << 20);

        assertEquals(Bottleneck.WORKLOAD_TOO_SMALL, analysis.getPrimary());
        assertEquals(0.95, analysis.getSeverity(), 1e-9);
        assertEquals(0.9, analysis.getContributingFactors().get(Bottleneck.INSUFFICIENT_COMPUTATION), 1e-9);
    }
}
