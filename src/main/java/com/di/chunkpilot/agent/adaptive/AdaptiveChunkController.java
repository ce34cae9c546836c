package com.di.chunkpilot.agent.adaptive;

import com.di.chunkpilot.exception.BatchExecutionException;
import com.di.chunkpilot.exception.ChunkPilotException;
import com.di.chunkpilot.exception.ClosedControllerException;
import com.di.chunkpilot.exception.ConfigurationException;
import com.di.chunkpilot.util.MetricsCollector;
import com.di.chunkpilot.worker.SerializableFunction;
import com.di.chunkpilot.worker.WorkerPool;
import com.di.chunkpilot.worker.WorkerPools;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs work over a {@link WorkerPool} in batches whose size follows observed batch durations.
 *
 * <p>Batches are sliced at dispatch time with the current size; batches already dispatched are
 * never resized. Every completed batch records its wall duration into the {@link BatchSizeAdapter}
 * under one lock, which covers only that bookkeeping and never dispatch or execution. At most
 * {@code maxInFlight} batches are outstanding; dispatching blocks for a free slot.
 *
 * <p>Inputs of at most twice the current batch size skip adaptation entirely.
 *
 * <p>{@link #close()} stops new submissions, {@link #join()} waits for outstanding batches,
 * {@link #terminate()} cancels them. {@link #getStats()} keeps working in every state.
 */
@Slf4j
public class AdaptiveChunkController implements AutoCloseable {

    public enum State { OPEN, CLOSED, TERMINATED }

    private static final Duration JOIN_POLL = Duration.ofSeconds(1);
    private static final int SLICE_CAPACITY_HINT = 1024;

    private final WorkerPool pool;
    private final BatchSizeAdapter adapter;
    private final MetricsCollector metricsCollector;
    private final Semaphore permits;
    private final int maxInFlight;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<CompletableFuture<?>> outstanding = ConcurrentHashMap.newKeySet();

    private long totalProcessed;
    private volatile State state = State.OPEN;

    public AdaptiveChunkController(AdaptiveSettings settings, MetricsCollector metricsCollector) {
        this(settings, null, metricsCollector);
    }

    /**
     * @param pool existing pool to drive; created from the settings when null
     */
    public AdaptiveChunkController(AdaptiveSettings settings, WorkerPool pool, MetricsCollector metricsCollector) {
        ConfigurationException.require(settings.getWorkerCount() >= 1,
                "workerCount must be >= 1, got " + settings.getWorkerCount());
        ConfigurationException.require(settings.getMaxInFlight() >= 0,
                "maxInFlight must be >= 0, got " + settings.getMaxInFlight());
        this.adapter = new BatchSizeAdapter(settings.getInitialBatchSize(), settings.getMinBatch(),
                settings.getMaxBatch(), settings.getTargetChunkSeconds(), settings.getAdaptationRate(),
                settings.getTolerance(), settings.getMinSamples(), settings.getWindowSize(), settings.isEnabled());
        this.metricsCollector = metricsCollector;
        this.maxInFlight = settings.getMaxInFlight() > 0 ? settings.getMaxInFlight() : settings.getWorkerCount();
        this.permits = new Semaphore(maxInFlight);
        this.pool = pool != null ? pool
                : WorkerPools.create(settings.getBackend(), settings.getWorkerCount(), settings.getCreationStrategy());
        log.info("[ADAPTIVE] controller started: workers={} backend={} batch={} bounds=[{}, {}] target={}s enabled={}",
                settings.getWorkerCount(), this.pool.backend(), adapter.getCurrentBatchSize(), adapter.getMinBatch(),
                adapter.getMaxBatch(), settings.getTargetChunkSeconds(), settings.isEnabled());
    }

    // ============================================================================
    // Submission
    // ============================================================================

    /** Results in input order. Blocks until every batch completed. */
    public <T, R> List<R> map(SerializableFunction<T, R> fn, Iterable<T> items) {
        List<R> out = new ArrayList<>();
        for (Batch<R> batch : open(fn, items, null).dispatchAll()) {
            out.addAll(await(batch));
        }
        return out;
    }

    /**
     * Results in input order; batches finishing early are buffered until their turn. Input is
     * sliced as results are consumed, keeping at most {@code maxInFlight} batches ahead of the
     * reader. Once the controller is closed, input not yet dispatched is not run and
     * {@code hasNext()} throws {@link ClosedControllerException}.
     */
    public <T, R> Iterator<R> imap(SerializableFunction<T, R> fn, Iterable<T> items) {
        Dispatch<T, R> dispatch = open(fn, items, null);
        Deque<Batch<R>> pending = new ArrayDeque<>();
        return new Iterator<>() {
            private Iterator<R> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    topUp();
                    Batch<R> head = pending.poll();
                    if (head == null) {
                        return false;
                    }
                    current = await(head).iterator();
                    topUp();
                }
                return true;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }

            private void topUp() {
                while (pending.size() < maxInFlight && dispatch.hasMore()) {
                    pending.add(dispatch.next());
                }
            }
        };
    }

    /**
     * Results as batches complete. Every result appears exactly once; order is not defined.
     * Input is sliced lazily as in {@link #imap}.
     */
    public <T, R> Iterator<R> imapUnordered(SerializableFunction<T, R> fn, Iterable<T> items) {
        BlockingQueue<Batch<R>> completed = new LinkedBlockingQueue<>();
        Dispatch<T, R> dispatch = open(fn, items, completed);
        return new Iterator<>() {
            private int running;
            private Iterator<R> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    while (running < maxInFlight && dispatch.hasMore()) {
                        dispatch.next();
                        running++;
                    }
                    if (running == 0) {
                        return false;
                    }
                    try {
                        Batch<R> next = completed.take();
                        running--;
                        current = await(next).iterator();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ChunkPilotException("Interrupted while waiting for batch results", e);
                    }
                }
                return true;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }

    /**
     * Dispatches on the calling thread (blocking for in-flight slots) and returns a future of the
     * results in input order. Fails with {@link BatchExecutionException} when any batch failed.
     */
    public <T, R> CompletableFuture<List<R>> submit(SerializableFunction<T, R> fn, Iterable<T> items) {
        List<Batch<R>> batches = open(fn, items, null).dispatchAll();
        CompletableFuture<?>[] futures = batches.stream().map(Batch::future).toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures).handle((ignored, error) -> {
            List<R> out = new ArrayList<>();
            for (Batch<R> batch : batches) {
                out.addAll(await(batch));
            }
            return out;
        });
    }

    /**
     * Starts one traversal. Only a prefix of at most twice the current batch size is read here,
     * to tell small inputs (which skip adaptation) from large ones.
     */
    private <T, R> Dispatch<T, R> open(SerializableFunction<T, R> fn, Iterable<T> items,
                                       BlockingQueue<Batch<R>> completions) {
        ensureOpen();
        long limit = currentBatchSize() * 2L;
        Iterator<T> source = items.iterator();
        List<T> prefix = new ArrayList<>();
        boolean track;
        if (items instanceof Collection<T> collection) {
            track = collection.size() > limit;
        } else {
            while (prefix.size() <= limit && source.hasNext()) {
                prefix.add(source.next());
            }
            track = prefix.size() > limit;
        }
        if (!track) {
            log.debug("[ADAPTIVE] input <= 2 x batch {}; dispatching without adaptation", limit / 2);
        }
        return new Dispatch<>(fn, prefix.iterator(), source, track, completions);
    }

    /** Cuts batches off the input with the batch size current at dispatch time. */
    private final class Dispatch<T, R> {
        private final SerializableFunction<T, R> fn;
        private final Iterator<T> prefix;
        private final Iterator<T> rest;
        private final boolean track;
        private final BlockingQueue<Batch<R>> completions;
        private int index;

        private Dispatch(SerializableFunction<T, R> fn, Iterator<T> prefix, Iterator<T> rest, boolean track,
                         BlockingQueue<Batch<R>> completions) {
            this.fn = fn;
            this.prefix = prefix;
            this.rest = rest;
            this.track = track;
            this.completions = completions;
        }

        boolean hasMore() {
            return prefix.hasNext() || rest.hasNext();
        }

        List<Batch<R>> dispatchAll() {
            List<Batch<R>> batches = new ArrayList<>();
            while (hasMore()) {
                batches.add(next());
            }
            return batches;
        }

        Batch<R> next() {
            ensureOpen();
            acquirePermit();
            List<T> slice;
            try {
                int size = currentBatchSize();
                slice = new ArrayList<>(Math.min(size, SLICE_CAPACITY_HINT));
                while (slice.size() < size && hasMore()) {
                    slice.add(prefix.hasNext() ? prefix.next() : rest.next());
                }
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            long start = System.nanoTime();
            CompletableFuture<List<R>> future;
            try {
                future = pool.submitBatch(fn, slice);
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            outstanding.add(future);
            Batch<R> batch = new Batch<>(index++, future);
            int items = slice.size();
            future.whenComplete((result, error) -> {
                permits.release();
                outstanding.remove(future);
                if (error == null) {
                    onBatchCompleted(System.nanoTime() - start, items, track);
                }
                if (completions != null) {
                    completions.add(batch);
                }
            });
            return batch;
        }
    }

    private void onBatchCompleted(long durationNanos, int items, boolean track) {
        boolean adapted = false;
        int newSize;
        lock.lock();
        try {
            totalProcessed += items;
            if (track) {
                adapted = adapter.record(durationNanos / 1e9);
            }
            newSize = adapter.getCurrentBatchSize();
        } finally {
            lock.unlock();
        }
        if (metricsCollector != null) {
            metricsCollector.recordBatchDuration(durationNanos);
            if (adapted) {
                metricsCollector.recordAdaptation();
            }
        }
        if (adapted) {
            log.debug("[ADAPTIVE] batch of {} took {}ms; batch size now {}", items,
                    durationNanos / 1_000_000, newSize);
        }
    }

    private <R> List<R> await(Batch<R> batch) {
        try {
            return batch.future().get();
        } catch (CancellationException e) {
            throw new ClosedControllerException(state == State.TERMINATED ? "terminated" : "closed");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof CancellationException) {
                throw new ClosedControllerException("terminated");
            }
            throw new BatchExecutionException(batch.index(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChunkPilotException("Interrupted while waiting for batch " + batch.index(), e);
        }
    }

    private void acquirePermit() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChunkPilotException("Interrupted while waiting for a free worker slot", e);
        }
    }

    // ============================================================================
    // Lifecycle and stats
    // ============================================================================

    /**
     * Stops accepting submissions and returns without waiting. Outstanding batches keep running;
     * see {@link #join()}. Child JVM workers exit on their own once those batches drain, so a
     * try-with-resources block does not leave processes behind.
     */
    @Override
    public void close() {
        if (state == State.OPEN) {
            state = State.CLOSED;
            pool.close();
            log.info("[ADAPTIVE] closed with {} batches outstanding", outstanding.size());
        }
    }

    /** Blocks until every outstanding batch finished; releases workers once closed. */
    public void join() {
        try {
            for (CompletableFuture<?> f : List.copyOf(outstanding)) {
                try {
                    f.get();
                } catch (ExecutionException | CancellationException e) {
                    log.debug("[ADAPTIVE] batch ended with {}", e.toString());
                }
            }
            if (state != State.OPEN) {
                while (!pool.awaitTermination(JOIN_POLL)) {
                    log.debug("[ADAPTIVE] waiting for workers to drain");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChunkPilotException("Interrupted while joining controller", e);
        }
    }

    /** Cancels outstanding batches and discards their results. Irreversible. */
    public void terminate() {
        if (state == State.TERMINATED) {
            return;
        }
        state = State.TERMINATED;
        pool.terminate();
        for (CompletableFuture<?> f : List.copyOf(outstanding)) {
            f.cancel(true);
        }
        outstanding.clear();
        log.info("[ADAPTIVE] terminated");
    }

    public AdaptiveStats getStats() {
        lock.lock();
        try {
            return new AdaptiveStats(adapter.getCurrentBatchSize(), totalProcessed, adapter.getAdaptationCount(),
                    adapter.averageDuration(), adapter.getWindowDepth(), adapter.getWindowCapacity(),
                    adapter.getMinBatch(), adapter.getMaxBatch(), adapter.isEnabled(), state);
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        return state;
    }

    private int currentBatchSize() {
        lock.lock();
        try {
            return adapter.getCurrentBatchSize();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        State s = state;
        if (s != State.OPEN) {
            throw new ClosedControllerException(s == State.TERMINATED ? "terminated" : "closed");
        }
    }

    private record Batch<R>(int index, CompletableFuture<List<R>> future) {}
}
