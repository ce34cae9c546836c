package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ClosedControllerException;
import com.di.chunkpilot.exception.ConfigurationException;
import com.di.chunkpilot.exception.TransferabilityException;
import com.di.chunkpilot.util.SerializationSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Worker Pool Tests")
class WorkerPoolsTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.terminate();
        }
    }

    // ============================================================================
    // Selection
    // ============================================================================

    @Test
    @DisplayName("Shared-memory backend selects the shared pool")
    void sharedBackend_selectsSharedPool() {
        pool = WorkerPools.create(BackendType.SHARED_MEMORY_WORKER, 2, WorkerCreationStrategy.PLATFORM_THREAD);
        assertInstanceOf(SharedMemoryWorkerPool.class, pool);
        assertEquals(BackendType.SHARED_MEMORY_WORKER, pool.backend());
        assertEquals(2, pool.workerCount());
    }

    @Test
    @DisplayName("Shared-memory backend never uses child JVMs")
    void sharedBackend_childJvmFallsBackToThreads() {
        pool = WorkerPools.create(BackendType.SHARED_MEMORY_WORKER, 1, WorkerCreationStrategy.CHILD_JVM);
        assertInstanceOf(SharedMemoryWorkerPool.class, pool);
    }

    @Test
    @DisplayName("Isolated backend with in-JVM strategies selects the serializing pool")
    void isolatedBackend_selectsSerializingPool() {
        pool = WorkerPools.create(BackendType.ISOLATED_WORKER, 2, WorkerCreationStrategy.FORK_JOIN);
        assertInstanceOf(SerializingWorkerPool.class, pool);
        assertEquals(BackendType.ISOLATED_WORKER, pool.backend());
    }

    @Test
    @DisplayName("Worker count below 1 is rejected")
    void zeroWorkers_rejected() {
        assertThrows(ConfigurationException.class,
                () -> new SharedMemoryWorkerPool(0, WorkerCreationStrategy.PLATFORM_THREAD));
        assertThrows(ConfigurationException.class,
                () -> new SerializingWorkerPool(0, WorkerCreationStrategy.PLATFORM_THREAD));
    }

    // ============================================================================
    // Execution
    // ============================================================================

    @ParameterizedTest(name = "{0}")
    @EnumSource(value = BackendType.class)
    @DisplayName("Batch results come back in batch order")
    void submitBatch_preservesOrder(BackendType backend) throws Exception {
        pool = WorkerPools.create(backend, 2, WorkerCreationStrategy.PLATFORM_THREAD);
        List<Integer> out = pool.submitBatch((Integer x) -> x * 10, List.of(1, 2, 3, 4)).get(5, TimeUnit.SECONDS);
        assertEquals(List.of(10, 20, 30, 40), out);
    }

    @Test
    @DisplayName("Isolated workers operate on copies; caller objects are never mutated")
    void isolatedPool_doesNotShareState() throws Exception {
        pool = new SerializingWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        ArrayList<String> item = new ArrayList<>(List.of("a"));
        List<Integer> sizes = pool.submitBatch((ArrayList<String> l) -> {
            l.add("mutated");
            return l.size();
        }, List.of(item)).get(5, TimeUnit.SECONDS);
        assertEquals(List.of(2), sizes);
        assertEquals(List.of("a"), item, "caller's item must be untouched");
    }

    @Test
    @DisplayName("Shared-memory workers see the caller's objects")
    void sharedPool_sharesState() throws Exception {
        pool = new SharedMemoryWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        ArrayList<String> item = new ArrayList<>(List.of("a"));
        pool.submitBatch((ArrayList<String> l) -> l.add("shared"), List.of(item)).get(5, TimeUnit.SECONDS);
        assertEquals(List.of("a", "shared"), item);
    }

    @Test
    @DisplayName("Non-serializable batch fails on the submitting thread")
    void isolatedPool_nonSerializableItem_throwsTransferability() {
        pool = new SerializingWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        List<Object> batch = List.of(new Object());
        TransferabilityException e = assertThrows(TransferabilityException.class,
                () -> pool.submitBatch((Object o) -> o.hashCode(), batch));
        assertEquals("batch", e.getSubject());
    }

    @Test
    @DisplayName("Function failures complete the future exceptionally")
    void functionFailure_completesExceptionally() {
        pool = new SharedMemoryWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        CompletableFuture<List<Integer>> f = pool.submitBatch((Integer x) -> 10 / x, List.of(1, 0));
        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    @DisplayName("MDC of the submitting thread is visible inside the worker")
    void mdc_propagatedToWorker() throws Exception {
        pool = new SharedMemoryWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        MDC.put("planId", "p-42");
        try {
            List<String> seen = pool.submitBatch((Integer x) -> MDC.get("planId"), List.of(1)).get(5, TimeUnit.SECONDS);
            assertEquals(List.of("p-42"), seen);
        } finally {
            MDC.remove("planId");
        }
    }

    // ============================================================================
    // Lifecycle
    // ============================================================================

    @Test
    @DisplayName("Close drains dispatched batches and then rejects new ones")
    void close_drainsThenRejects() throws Exception {
        pool = new SharedMemoryWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        CompletableFuture<List<Integer>> running = pool.submitBatch((Integer x) -> {
            sleep(50);
            return x;
        }, List.of(7));
        pool.close();
        assertTrue(pool.isClosed());
        assertThrows(ClosedControllerException.class, () -> pool.submitBatch((Integer x) -> x, List.of(1)));
        assertTrue(pool.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(List.of(7), running.get());
    }

    @Test
    @DisplayName("Terminate cancels in-flight batches")
    void terminate_cancelsInFlight() throws Exception {
        pool = new SharedMemoryWorkerPool(1, WorkerCreationStrategy.PLATFORM_THREAD);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<List<Integer>> blocked = pool.submitBatch((Integer x) -> {
            started.countDown();
            sleep(10_000);
            return x;
        }, List.of(1));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        pool.terminate();
        assertTrue(blocked.isCancelled());
        assertThrows(ClosedControllerException.class, () -> pool.submitBatch((Integer x) -> x, List.of(1)));
    }

    // ============================================================================
    // Child JVM protocol
    // ============================================================================

    @Test
    @DisplayName("Worker main answers a request with the function's results")
    void isolatedWorkerMain_handlesRequest() {
        byte[] request = SerializationSupport.toBytes(
                BatchRequest.of((Integer x) -> x + 1, List.of(1, 2)));
        BatchResponse response = SerializationSupport.fromBytes(IsolatedWorkerMain.handle(request));
        assertFalse(response.failed());
        assertEquals(List.of(2, 3), response.results());
    }

    @Test
    @DisplayName("Worker main reports function failures as text")
    void isolatedWorkerMain_reportsFailure() {
        byte[] request = SerializationSupport.toBytes(
                BatchRequest.of((Integer x) -> 1 / x, List.of(0)));
        BatchResponse response = SerializationSupport.fromBytes(IsolatedWorkerMain.handle(request));
        assertTrue(response.failed());
        assertEquals(ArithmeticException.class.getName(), response.errorType());
    }

    @Test
    @DisplayName("Child JVM workers run batches in a separate process")
    void childJvm_runsBatchesOutOfProcess() throws Exception {
        pool = WorkerPools.create(BackendType.ISOLATED_WORKER, 1, WorkerCreationStrategy.CHILD_JVM);
        assertInstanceOf(ChildJvmWorkerPool.class, pool);

        List<Long> pids = pool.submitBatch((Integer x) -> ProcessHandle.current().pid(), List.of(1, 2))
                .get(60, TimeUnit.SECONDS);
        assertEquals(2, pids.size());
        assertNotEquals(ProcessHandle.current().pid(), pids.get(0), "batch must not run in the test JVM");

        List<Integer> out = pool.submitBatch((Integer x) -> x * 10, List.of(1, 2, 3)).get(60, TimeUnit.SECONDS);
        assertEquals(List.of(10, 20, 30), out);
    }

    @Test
    @DisplayName("Function failures inside a child come back as IsolatedWorkerException")
    void childJvm_functionFailure() throws Exception {
        pool = new ChildJvmWorkerPool(1);
        CompletableFuture<List<Integer>> f = pool.submitBatch((Integer x) -> 1 / x, List.of(0));

        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(60, TimeUnit.SECONDS));
        assertInstanceOf(IsolatedWorkerException.class, e.getCause());
        assertEquals(List.of(1), pool.submitBatch((Integer x) -> x, List.of(1)).get(60, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A child that dies mid-batch fails that batch and is replaced")
    void childJvm_deadChildReplaced() throws Exception {
        ChildJvmWorkerPool childPool = new ChildJvmWorkerPool(1);
        pool = childPool;
        long firstPid = childPool.workers().get(0).pid();

        CompletableFuture<List<Integer>> dying = childPool.submitBatch((Integer x) -> {
            Runtime.getRuntime().halt(3);
            return x;
        }, List.of(1));
        ExecutionException e = assertThrows(ExecutionException.class, () -> dying.get(60, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e.getCause());

        List<Integer> after = childPool.submitBatch((Integer x) -> x + 1, List.of(1, 2)).get(60, TimeUnit.SECONDS);
        assertEquals(List.of(2, 3), after);
        assertEquals(1, childPool.workers().size());
        assertNotEquals(firstPid, childPool.workers().get(0).pid(), "dead child should have been relaunched");
    }

    @Test
    @DisplayName("Closing a child JVM pool shuts the children down once batches drain")
    void childJvm_closeReleasesChildren() throws Exception {
        ChildJvmWorkerPool childPool = new ChildJvmWorkerPool(1);
        pool = childPool;
        assertEquals(List.of(2), childPool.submitBatch((Integer x) -> x * 2, List.of(1)).get(60, TimeUnit.SECONDS));
        ChildJvmWorker child = childPool.workers().get(0);

        childPool.close();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        while (child.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(child.isAlive(), "child JVM still running after close");
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
