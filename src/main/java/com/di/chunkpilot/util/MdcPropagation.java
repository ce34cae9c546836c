package com.di.chunkpilot.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Propagates SLF4J MDC from the thread that plans or submits work to the worker threads
 * that execute batches, so log lines emitted by the unit-of-work function carry the
 * caller's correlation keys.
 * <p>
 * MDC is thread-local; without propagation, logs from pool threads and
 * {@code CompletableFuture} stages lose the caller's context.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code executor.submit(MdcPropagation.wrapCallable(() -> runBatch()));}</li>
 *   <li>Wrap a runnable handed to a pool: {@code executor.execute(MdcPropagation.wrapRunnable(task));}</li>
 * </ul>
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that, when run on another thread,
     * sets that MDC for the duration of the task and clears it in {@code finally}.
     *
     * @param task the task to run in the worker thread
     * @return a runnable that propagates MDC then runs the task
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Captures the current thread's MDC and returns a Callable that restores it around {@code call()}.
     *
     * @param task the task to run in the worker thread
     * @return a callable that propagates MDC then runs the task
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
