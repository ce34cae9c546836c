package com.di.chunkpilot.agent.execution;

import com.di.chunkpilot.agent.adaptive.AdaptiveChunkController;
import com.di.chunkpilot.agent.adaptive.AdaptiveChunkControllerFactory;
import com.di.chunkpilot.agent.adaptive.AdaptiveStats;
import com.di.chunkpilot.agent.planner.Decision;
import com.di.chunkpilot.agent.planner.PlannerService;
import com.di.chunkpilot.agent.planner.PlanningConstraints;
import com.di.chunkpilot.worker.SerializableFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans and runs a function over a dataset in one call.
 *
 * <p>Serial decisions run on the calling thread. Anything else goes through an
 * {@link AdaptiveChunkController} seeded from the decision, which is closed and joined before
 * returning so no workers outlive the call. A failing item propagates as the controller reports it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionService {

    private final PlannerService plannerService;
    private final AdaptiveChunkControllerFactory controllerFactory;

    public <T, R> ExecutionResult<R> execute(SerializableFunction<T, R> fn, Iterable<T> dataset) {
        return execute(fn, dataset, plannerService.defaultConstraints().build());
    }

    public <T, R> ExecutionResult<R> execute(SerializableFunction<T, R> fn, Iterable<T> dataset,
                                             PlanningConstraints constraints) {
        long startMs = System.currentTimeMillis();
        Decision decision = plannerService.decide(fn, dataset, constraints);
        Iterable<T> data = decision.getData() != null ? decision.<T>getData() : dataset;

        List<R> results;
        AdaptiveStats stats = null;
        if (decision.isSerial()) {
            results = new ArrayList<>();
            for (T item : data) {
                results.add(fn.apply(item));
            }
        } else {
            AdaptiveChunkController controller = controllerFactory.fromDecision(decision);
            try {
                results = controller.map(fn, data);
            } finally {
                controller.close();
                controller.join();
            }
            stats = controller.getStats();
        }

        long durationMs = System.currentTimeMillis() - startMs;
        log.info("[EXECUTION] {} items, reason={} workers={} in {}ms", results.size(), decision.getReason(),
                decision.getWorkerCount(), durationMs);
        return new ExecutionResult<>(results, decision, stats, durationMs);
    }
}
