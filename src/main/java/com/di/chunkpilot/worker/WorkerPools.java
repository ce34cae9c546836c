package com.di.chunkpilot.worker;

/**
 * Selects the worker pool implementation for a backend and creation strategy.
 */
public final class WorkerPools {

    private WorkerPools() {}

    public static WorkerPool create(BackendType backend, int workerCount, WorkerCreationStrategy strategy) {
        if (backend == BackendType.SHARED_MEMORY_WORKER) {
            WorkerCreationStrategy shared = strategy == WorkerCreationStrategy.CHILD_JVM
                    ? WorkerCreationStrategy.PLATFORM_THREAD : strategy;
            return new SharedMemoryWorkerPool(workerCount, shared);
        }
        if (strategy == WorkerCreationStrategy.CHILD_JVM) {
            return new ChildJvmWorkerPool(workerCount);
        }
        return new SerializingWorkerPool(workerCount, strategy);
    }
}
