package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ClosedControllerException;
import com.di.chunkpilot.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared lifecycle for worker pools: in-flight tracking, close / terminate semantics and
 * MDC propagation. Subclasses only decide how a batch is prepared on the caller thread and
 * what runs on the worker.
 */
@Slf4j
abstract class AbstractWorkerPool implements WorkerPool {

    private final BackendType backend;
    private final int workerCount;
    private final ExecutorService executor;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean released = new AtomicBoolean();

    private volatile boolean closed;
    private volatile boolean terminated;

    protected AbstractWorkerPool(BackendType backend, int workerCount, ExecutorService executor) {
        this.backend = backend;
        this.workerCount = workerCount;
        this.executor = executor;
    }

    /**
     * Runs on the submitting thread; returns the work executed by a worker.
     */
    protected abstract <T, R> Callable<List<R>> prepare(SerializableFunction<T, R> fn, List<T> batch);

    @Override
    public BackendType backend() {
        return backend;
    }

    @Override
    public int workerCount() {
        return workerCount;
    }

    @Override
    public <T, R> CompletableFuture<List<R>> submitBatch(SerializableFunction<T, R> fn, List<T> batch) {
        ensureOpen();
        Callable<List<R>> work = prepare(fn, batch);
        CompletableFuture<List<R>> future = new CompletableFuture<>();
        Runnable task = MdcPropagation.wrapRunnable(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(work.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        inFlight.add(future);
        future.whenComplete((r, e) -> inFlight.remove(future));
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(future);
            throw new ClosedControllerException(terminated ? "terminated" : "closed");
        }
        return future;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            executor.shutdown();
            log.debug("[WORKER] {} pool closed ({} batches in flight)", backend, inFlight.size());
            releaseAfterDrain();
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        boolean done = executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (done) {
            release();
        }
        return done;
    }

    @Override
    public void terminate() {
        closed = true;
        terminated = true;
        executor.shutdownNow();
        int cancelled = 0;
        for (CompletableFuture<?> f : inFlight) {
            if (f.cancel(true)) {
                cancelled++;
            }
        }
        inFlight.clear();
        released.set(true);
        destroyWorkers();
        log.info("[WORKER] {} pool terminated, {} in-flight batches cancelled", backend, cancelled);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Called once from {@link #close()}. Pools whose workers outlive the executor override this
     * to release them without anyone calling {@link #awaitTermination}.
     */
    protected void releaseAfterDrain() {
    }

    /** Waits for the executor to drain on the calling thread, then releases the workers. */
    protected final void awaitDrainAndRelease() {
        try {
            while (!awaitTermination(Duration.ofSeconds(1))) {
                log.trace("[WORKER] {} pool still draining", backend);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[WORKER] {} pool release interrupted", backend);
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            releaseWorkers();
        }
    }

    /** Orderly release after a drain. Runs at most once. */
    protected void releaseWorkers() {
    }

    /** Forced release on terminate. */
    protected void destroyWorkers() {
    }

    private void ensureOpen() {
        if (closed) {
            throw new ClosedControllerException(terminated ? "terminated" : "closed");
        }
    }
}
