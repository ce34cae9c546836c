package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ConfigurationException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;

/**
 * Threads sharing the caller's heap. The function is applied directly to the caller's items.
 */
public class SharedMemoryWorkerPool extends AbstractWorkerPool {

    public SharedMemoryWorkerPool(int workerCount, WorkerCreationStrategy strategy) {
        super(BackendType.SHARED_MEMORY_WORKER, workerCount, executorFor(workerCount, strategy));
    }

    static ExecutorService executorFor(int workerCount, WorkerCreationStrategy strategy) {
        ConfigurationException.require(workerCount >= 1, "workerCount must be >= 1, got " + workerCount);
        ConfigurationException.require(strategy != WorkerCreationStrategy.CHILD_JVM,
                "CHILD_JVM workers cannot share memory with the caller");
        if (strategy == WorkerCreationStrategy.FORK_JOIN) {
            return new ForkJoinPool(workerCount);
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("chunkpilot-shared-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(workerCount, threadFactory);
    }

    @Override
    protected <T, R> Callable<List<R>> prepare(SerializableFunction<T, R> fn, List<T> batch) {
        return () -> {
            List<R> results = new ArrayList<>(batch.size());
            for (T item : batch) {
                results.add(fn.apply(item));
            }
            return results;
        };
    }
}
