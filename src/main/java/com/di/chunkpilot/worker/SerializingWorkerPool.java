package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ConfigurationException;
import com.di.chunkpilot.exception.TransferabilityException;
import com.di.chunkpilot.util.SerializationSupport;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;

/**
 * Isolated workers inside this JVM. The function and batch are serialized on the submitting
 * thread and materialized afresh inside the worker; results travel back the same way, so no
 * object graph is shared between the caller and a worker.
 */
public class SerializingWorkerPool extends AbstractWorkerPool {

    public SerializingWorkerPool(int workerCount, WorkerCreationStrategy strategy) {
        super(BackendType.ISOLATED_WORKER, workerCount, executorFor(workerCount, strategy));
    }

    private static ExecutorService executorFor(int workerCount, WorkerCreationStrategy strategy) {
        ConfigurationException.require(workerCount >= 1, "workerCount must be >= 1, got " + workerCount);
        if (strategy == WorkerCreationStrategy.FORK_JOIN) {
            return new ForkJoinPool(workerCount);
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("chunkpilot-isolated-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(workerCount, threadFactory);
    }

    @Override
    protected <T, R> Callable<List<R>> prepare(SerializableFunction<T, R> fn, List<T> batch) {
        byte[] request;
        try {
            request = SerializationSupport.toBytes(BatchRequest.of(fn, batch));
        } catch (RuntimeException e) {
            throw new TransferabilityException("batch", e);
        }
        return () -> {
            BatchRequest materialized = SerializationSupport.fromBytes(request);
            ArrayList<Object> results = materialized.apply();
            return SerializationSupport.fromBytes(SerializationSupport.toBytes(results));
        };
    }
}
