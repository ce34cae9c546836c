package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ConfigurationException;
import com.di.chunkpilot.exception.TransferabilityException;
import com.di.chunkpilot.util.SerializationSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Isolated workers as child JVM processes. Each pool thread borrows one child for the duration
 * of a batch, so at most {@code workerCount} batches run concurrently. Children are started
 * eagerly: the creation cost is paid once per worker, not per batch.
 *
 * <p>A child that dies or breaks the protocol fails its batch and is replaced by a fresh child
 * the next time a batch borrows that slot. After {@link #close()} the children are shut down by
 * a background thread as soon as the dispatched batches drain.
 */
@Slf4j
public class ChildJvmWorkerPool extends AbstractWorkerPool {

    private final List<ChildJvmWorker> workers;
    private final BlockingQueue<ChildJvmWorker> idle;

    public ChildJvmWorkerPool(int workerCount) {
        super(BackendType.ISOLATED_WORKER, workerCount, newExecutor(workerCount));
        this.workers = new CopyOnWriteArrayList<>();
        this.idle = new LinkedBlockingQueue<>();
        try {
            for (int i = 0; i < workerCount; i++) {
                ChildJvmWorker worker = ChildJvmWorker.launch();
                workers.add(worker);
                idle.add(worker);
            }
        } catch (IOException e) {
            workers.forEach(ChildJvmWorker::destroy);
            super.terminate();
            throw new UncheckedIOException("Failed to start child JVM workers", e);
        }
        log.info("[WORKER] started {} child JVM workers", workerCount);
    }

    private static ExecutorService newExecutor(int workerCount) {
        ConfigurationException.require(workerCount >= 1, "workerCount must be >= 1, got " + workerCount);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("chunkpilot-child-");
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
            ChildJvmWorker worker = idle.take();
            try {
                worker = usable(worker);
                return worker.execute(request);
            } catch (IOException e) {
                log.warn("[WORKER] child JVM pid={} failed mid-batch, replacing it: {}", worker.pid(), e.getMessage());
                worker.destroy();
                throw e;
            } finally {
                idle.add(worker);
            }
        };
    }

    /** The borrowed worker, or a freshly launched replacement when it is no longer usable. */
    private ChildJvmWorker usable(ChildJvmWorker worker) throws IOException {
        if (worker.isUsable()) {
            return worker;
        }
        worker.destroy();
        ChildJvmWorker replacement = ChildJvmWorker.launch();
        workers.remove(worker);
        workers.add(replacement);
        log.info("[WORKER] replaced child JVM pid={} with pid={}", worker.pid(), replacement.pid());
        return replacement;
    }

    /** Snapshot of the current children. */
    List<ChildJvmWorker> workers() {
        return List.copyOf(workers);
    }

    @Override
    protected void releaseAfterDrain() {
        Thread reaper = new CustomizableThreadFactory("chunkpilot-child-release-")
                .newThread(this::awaitDrainAndRelease);
        reaper.setDaemon(true);
        reaper.start();
    }

    @Override
    protected void releaseWorkers() {
        workers.forEach(ChildJvmWorker::close);
        log.debug("[WORKER] released {} child JVM workers", workers.size());
    }

    @Override
    protected void destroyWorkers() {
        if (workers != null) {
            workers.forEach(ChildJvmWorker::destroy);
        }
    }
}
