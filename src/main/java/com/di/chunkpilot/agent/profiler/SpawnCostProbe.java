package com.di.chunkpilot.agent.profiler;

import com.di.chunkpilot.worker.ChildJvmWorker;
import com.di.chunkpilot.worker.WorkerCreationStrategy;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Creates and tears down one minimal worker of a strategy and returns the elapsed seconds.
 * Implementations may throw; the profiler replaces failures with the static estimate.
 */
@FunctionalInterface
public interface SpawnCostProbe {

    double measureSeconds(WorkerCreationStrategy strategy) throws Exception;

    static SpawnCostProbe defaultProbe() {
        return strategy -> {
            long start = System.nanoTime();
            switch (strategy) {
                case PLATFORM_THREAD -> {
                    Thread t = new Thread(() -> { }, "chunkpilot-spawn-probe");
                    t.start();
                    t.join();
                }
                case FORK_JOIN -> {
                    ForkJoinPool pool = new ForkJoinPool(1);
                    try {
                        pool.submit(() -> { }).get();
                    } finally {
                        pool.shutdown();
                        pool.awaitTermination(1, TimeUnit.SECONDS);
                    }
                }
                case CHILD_JVM -> ChildJvmWorker.launch().close();
            }
            return (System.nanoTime() - start) / 1e9;
        };
    }
}
