package com.di.chunkpilot.agent.estimator;

import com.di.chunkpilot.agent.profiler.SystemProfile;
import com.di.chunkpilot.agent.sampler.SampleResult;
import com.di.chunkpilot.worker.BackendType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Predicts parallel execution time for a candidate:
 * {@code parallel = serial / w + spawnCost * w + ceil(N / b) * (dispatch + b * perItemTransfer)}.
 * The shared-memory backend has no serialization boundary, so its per-item transfer is zero.
 */
@Slf4j
@Service
public class CostModel {

    public CostEstimate computeSpeedup(int workerCount, int batchSize, SampleResult sample,
                                       SystemProfile profile, BackendType backend) {
        int w = Math.max(1, workerCount);
        int b = Math.max(1, batchSize);
        long n = sample.getTotalItems();
        double serial = sample.getMeanItemSeconds() * n;

        if (w == 1 || n == 0) {
            return CostEstimate.builder()
                    .workerCount(w)
                    .batchSize(b)
                    .backend(backend)
                    .estimatedSpeedup(1.0)
                    .serialSeconds(serial)
                    .parallelSeconds(serial)
                    .computeSeconds(serial)
                    .batchCount(n == 0 ? 0 : 1)
                    .rationale("single worker runs serially")
                    .build();
        }

        double perItemTransfer = backend == BackendType.SHARED_MEMORY_WORKER ? 0.0 : sample.getPerItemTransferSeconds();
        long batches = (n + b - 1) / b;
        double compute = serial / w;
        double spawn = profile.getSpawnCostSeconds() * w;
        double dispatch = batches * profile.getDispatchOverheadSeconds();
        double transfer = batches * (b * perItemTransfer);
        double parallel = compute + spawn + dispatch + transfer;
        double speedup = parallel > 0 ? Math.min(serial / parallel, w) : w;

        CostEstimate estimate = CostEstimate.builder()
                .workerCount(w)
                .batchSize(b)
                .backend(backend)
                .estimatedSpeedup(speedup)
                .serialSeconds(serial)
                .parallelSeconds(parallel)
                .computeSeconds(compute)
                .spawnOverheadSeconds(spawn)
                .transferOverheadSeconds(transfer)
                .dispatchOverheadSeconds(dispatch)
                .batchCount(batches)
                .rationale(String.format("compute=%.4fs spawn=%.4fs dispatch=%.4fs transfer=%.4fs over %d batches",
                        compute, spawn, dispatch, transfer, batches))
                .build();
        log.trace("[COST-MODEL] w={} b={} speedup={} {}", w, b, String.format("%.3f", speedup), estimate.getRationale());
        return estimate;
    }
}
