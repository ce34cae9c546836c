package com.di.chunkpilot.agent.estimator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explains a cost estimate: which overhead dominates and what would help.
 */
@Slf4j
@Component
public class BottleneckAnalyzer {

    static final double SPAWN_SHARE = 0.2;
    static final double TRANSFER_SHARE = 0.15;
    static final double DISPATCH_SHARE = 0.1;
    static final double MEMORY_RATIO = 0.7;
    static final double LIGHT_ITEM_SECONDS = 0.001;
    static final double SMALL_WORKLOAD_SECONDS = 1.0;
    static final double HETEROGENEOUS_CV = 0.5;

    /**
     * @param estimate              the chosen (or best rejected) candidate
     * @param meanItemSeconds       mean per-item time of the sample
     * @param coefficientOfVariation variability of item times
     * @param physicalCores         cores available
     * @param availableMemoryBytes  memory available
     * @param memoryPerWorkerBytes  estimated memory per worker
     */
    public BottleneckAnalysis analyze(CostEstimate estimate, double meanItemSeconds, double coefficientOfVariation,
                                      int physicalCores, long availableMemoryBytes, double memoryPerWorkerBytes) {
        int workers = estimate.getWorkerCount();
        double parallel = estimate.getComputeSeconds() + estimate.getSpawnOverheadSeconds()
                + estimate.getTransferOverheadSeconds() + estimate.getDispatchOverheadSeconds();
        double serial = estimate.getSerialSeconds();
        double theoreticalMax = Math.min(workers, Math.max(1, physicalCores));
        double efficiency = Math.max(0.0, Math.min(1.0, estimate.getEstimatedSpeedup() / theoreticalMax));

        Map<Bottleneck, Double> found = new LinkedHashMap<>();
        List<String> recommendations = new ArrayList<>();
        BottleneckAnalysis.BottleneckAnalysisBuilder analysis = BottleneckAnalysis.builder()
                .efficiencyScore(efficiency);

        if (parallel > 0) {
            analysis.overhead("computation", 100.0 * estimate.getComputeSeconds() / parallel)
                    .overhead("spawn", 100.0 * estimate.getSpawnOverheadSeconds() / parallel)
                    .overhead("transfer", 100.0 * estimate.getTransferOverheadSeconds() / parallel)
                    .overhead("dispatch", 100.0 * estimate.getDispatchOverheadSeconds() / parallel);

            double spawnShare = estimate.getSpawnOverheadSeconds() / parallel;
            if (spawnShare > SPAWN_SHARE) {
                found.put(Bottleneck.SPAWN_OVERHEAD, spawnShare);
                recommendations.add(String.format("Worker creation dominates (%.1f%%): reuse a long-lived pool "
                        + "or use a cheaper creation strategy", spawnShare * 100));
            }
            double transferShare = estimate.getTransferOverheadSeconds() / parallel;
            if (transferShare > TRANSFER_SHARE) {
                found.put(Bottleneck.TRANSFER_OVERHEAD, transferShare);
                recommendations.add(String.format("Serialization costs %.1f%% of parallel time: pass smaller items "
                        + "or use the shared-memory backend", transferShare * 100));
            }
            double dispatchShare = estimate.getDispatchOverheadSeconds() / parallel;
            if (dispatchShare > DISPATCH_SHARE) {
                found.put(Bottleneck.DISPATCH_OVERHEAD, dispatchShare);
                recommendations.add(String.format("%d batches pay %.1f%% in hand-off cost: raise batch size from %d to %d",
                        estimate.getBatchCount(), dispatchShare * 100, estimate.getBatchSize(), estimate.getBatchSize() * 2));
            }
        }

        double memoryRatio = availableMemoryBytes > 0 ? workers * memoryPerWorkerBytes / availableMemoryBytes : 0.0;
        if (workers < physicalCores && memoryRatio > MEMORY_RATIO) {
            found.put(Bottleneck.MEMORY_CONSTRAINT, Math.min(1.0, memoryRatio));
            recommendations.add(String.format("Memory limits workers to %d of %d cores: process smaller batches "
                    + "or reduce per-item allocation", workers, physicalCores));
        }
        if (meanItemSeconds > 0 && meanItemSeconds < LIGHT_ITEM_SECONDS) {
            found.put(Bottleneck.INSUFFICIENT_COMPUTATION, 1.0 - Math.min(1.0, meanItemSeconds / LIGHT_ITEM_SECONDS));
            recommendations.add(String.format("Each item takes %.3fms: overhead dominates, group more work per item",
                    meanItemSeconds * 1000));
        }
        if (serial > 0 && serial < SMALL_WORKLOAD_SECONDS) {
            found.put(Bottleneck.WORKLOAD_TOO_SMALL, 1.0 - Math.min(1.0, serial));
            recommendations.add(String.format("Total workload is %.3fs: run serially or accumulate more data", serial));
        }
        if (coefficientOfVariation > HETEROGENEOUS_CV) {
            found.put(Bottleneck.HETEROGENEOUS_WORKLOAD, Math.min(1.0, coefficientOfVariation));
            recommendations.add(String.format("Item times vary (CV=%.2f): use adaptive batching with unordered results",
                    coefficientOfVariation));
        }

        List<Map.Entry<Bottleneck, Double>> ranked = new ArrayList<>(found.entrySet());
        ranked.sort(Map.Entry.<Bottleneck, Double>comparingByValue(Comparator.reverseOrder()));
        if (ranked.isEmpty()) {
            analysis.primary(Bottleneck.NONE).severity(0.0);
            if (efficiency > 0.8) {
                recommendations.add("Excellent parallel efficiency; no significant bottleneck");
            } else if (efficiency > 0.5) {
                recommendations.add("Good parallel efficiency; minor tuning possible");
            }
        } else {
            analysis.primary(ranked.get(0).getKey()).severity(ranked.get(0).getValue());
            for (Map.Entry<Bottleneck, Double> e : ranked.subList(1, ranked.size())) {
                analysis.contributingFactor(e.getKey(), e.getValue());
            }
        }
        BottleneckAnalysis result = analysis.recommendations(recommendations).build();
        log.debug("[COST-MODEL] bottleneck={} severity={} efficiency={}", result.getPrimary(),
                String.format("%.2f", result.getSeverity()), String.format("%.2f", efficiency));
        return result;
    }
}
