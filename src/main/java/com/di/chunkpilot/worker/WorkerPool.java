package com.di.chunkpilot.worker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A fixed set of workers executing whole batches. One contract for both backends; the
 * adaptive controller builds map / imap / unordered traversal on top of {@link #submitBatch}.
 */
public interface WorkerPool {

    BackendType backend();

    int workerCount();

    /**
     * Dispatches one batch. The returned future completes with the results in batch order,
     * exceptionally when the function failed on any item, or is cancelled by {@link #terminate()}.
     *
     * @throws com.di.chunkpilot.exception.ClosedControllerException when the pool no longer accepts work
     */
    <T, R> CompletableFuture<List<R>> submitBatch(SerializableFunction<T, R> fn, List<T> batch);

    /** Stops accepting batches; already dispatched batches run to completion. */
    void close();

    /** Blocks until all dispatched batches finished after {@link #close()}. */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /** Cancels dispatched batches and releases workers. Irreversible. */
    void terminate();

    boolean isClosed();
}
