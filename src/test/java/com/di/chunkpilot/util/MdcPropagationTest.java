package com.di.chunkpilot.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Runnable sees the submitter's MDC on a worker thread")
    void wrapRunnable_propagates() throws Exception {
        MDC.put("runId", "r-42");
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> after = new AtomicReference<>();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(MdcPropagation.wrapRunnable(() -> seen.set(MDC.get("runId")))).get(5, TimeUnit.SECONDS);
            executor.submit(() -> after.set(MDC.get("runId"))).get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals("r-42", seen.get());
        assertNull(after.get(), "worker MDC must be cleared after the task");
    }

    @Test
    @DisplayName("Callable returns its value with the captured MDC")
    void wrapCallable_propagates() throws Exception {
        MDC.put("fn", "triple");
        Callable<String> wrapped = MdcPropagation.wrapCallable(() -> MDC.get("fn") + ":ok");
        MDC.clear();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertEquals("triple:ok", executor.submit(wrapped).get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Empty MDC copies as an empty map")
    void copyMdc_empty() {
        assertNotNull(MdcPropagation.copyMdc());
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
