package com.di.chunkpilot.agent.adaptive;

import com.di.chunkpilot.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchSizeAdapter Tests")
class BatchSizeAdapterTest {

    private static BatchSizeAdapter adapter(int initial, int min, int max) {
        return new BatchSizeAdapter(initial, min, max, 0.2, 0.3, 0.2, 3, 10, true);
    }

    // ============================================================================
    // Feedback loop
    // ============================================================================

    @Test
    @DisplayName("Slow batches shrink the size once enough samples arrived")
    void slowBatches_shrink() {
        BatchSizeAdapter adapter = adapter(20, 1, Integer.MAX_VALUE);

        assertFalse(adapter.record(0.8));
        assertFalse(adapter.record(0.8));
        assertEquals(20, adapter.getCurrentBatchSize(), "no change before three samples");

        assertTrue(adapter.record(0.8));
        assertEquals(16, adapter.getCurrentBatchSize());
        assertEquals(0, adapter.getWindowDepth(), "window restarts after a size change");

        assertFalse(adapter.record(0.8));
        assertFalse(adapter.record(0.8));
        assertTrue(adapter.record(0.8));
        assertEquals(12, adapter.getCurrentBatchSize());

        for (int i = 0; i < 3; i++) {
            adapter.record(0.8);
        }
        assertEquals(9, adapter.getCurrentBatchSize());
        assertEquals(3, adapter.getAdaptationCount());
    }

    @Test
    @DisplayName("Durations proportional to size converge near the target without overshooting")
    void proportionalDurations_convergeWithoutOvershoot() {
        BatchSizeAdapter adapter = adapter(20, 1, 1000);
        List<Integer> trajectory = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            trajectory.add(adapter.getCurrentBatchSize());
            adapter.record(adapter.getCurrentBatchSize() * 0.04);
        }

        for (int i = 1; i < trajectory.size(); i++) {
            assertTrue(trajectory.get(i) <= trajectory.get(i - 1), "size went back up: " + trajectory);
        }
        int last = adapter.getCurrentBatchSize();
        assertTrue(last >= 5 && last <= 7, "ideal size is 5, got " + last + " in " + trajectory);
        assertTrue(trajectory.stream().allMatch(size -> size >= 5), "undershot the ideal: " + trajectory);
        assertTrue(adapter.getAdaptationCount() <= 8, "too many adaptations: " + adapter.getAdaptationCount());
    }

    @Test
    @DisplayName("Fast batches grow the size up to the maximum")
    void fastBatches_growToMax() {
        BatchSizeAdapter adapter = adapter(20, 1, 30);
        for (int i = 0; i < 10; i++) {
            adapter.record(0.01);
        }

        assertEquals(30, adapter.getCurrentBatchSize());
        assertEquals(1, adapter.getAdaptationCount(), "clipped proposals that change nothing are not counted");
    }

    @Test
    @DisplayName("Very slow batches shrink the size down to the minimum")
    void verySlowBatches_shrinkToMin() {
        BatchSizeAdapter adapter = adapter(50, 5, 100);
        for (int i = 0; i < 40; i++) {
            adapter.record(30.0);
        }
        assertEquals(5, adapter.getCurrentBatchSize());
    }

    @Test
    @DisplayName("Durations within tolerance of the target change nothing")
    void withinTolerance_stable() {
        BatchSizeAdapter adapter = adapter(20, 1, 100);
        double[] durations = {0.2, 0.17, 0.23, 0.21, 0.19, 0.2, 0.235, 0.165};
        for (double d : durations) {
            assertFalse(adapter.record(d));
        }
        assertEquals(20, adapter.getCurrentBatchSize());
        assertEquals(0, adapter.getAdaptationCount());
    }

    @Test
    @DisplayName("Size stays within bounds for a duration proportional to size")
    void proportionalDurations_bounded() {
        BatchSizeAdapter adapter = adapter(80, 3, 500);
        for (int i = 0; i < 200; i++) {
            adapter.record(adapter.getCurrentBatchSize() * 0.01);
            assertTrue(adapter.getCurrentBatchSize() >= 3 && adapter.getCurrentBatchSize() <= 500,
                    "size " + adapter.getCurrentBatchSize() + " at step " + i);
            assertTrue(adapter.getWindowDepth() <= adapter.getWindowCapacity());
        }
        assertTrue(adapter.getCurrentBatchSize() < 80, "should have moved towards 20, got "
                + adapter.getCurrentBatchSize());
    }

    @Test
    @DisplayName("Window evicts the oldest duration when full")
    void window_evictsOldest() {
        BatchSizeAdapter adapter = new BatchSizeAdapter(10, 1, 100, 0.2, 0.3, 0.2, 3, 3, false);
        adapter.observe(1.0);
        adapter.observe(2.0);
        adapter.observe(3.0);
        adapter.observe(6.0);

        assertEquals(3, adapter.getWindowDepth());
        assertEquals(11.0 / 3, adapter.averageDuration(), 1e-12);
    }

    @Test
    @DisplayName("Window fills to capacity and stays there")
    void window_stabilizesAtCapacity() {
        BatchSizeAdapter adapter = adapter(20, 1, 100);
        for (int i = 1; i <= 11; i++) {
            adapter.record(0.2);
            assertEquals(Math.min(i, 10), adapter.getWindowDepth());
        }
        adapter.record(0.2);
        assertEquals(10, adapter.getWindowDepth());
    }

    @Test
    @DisplayName("Disabled adapter observes but never adapts")
    void disabled_neverAdapts() {
        BatchSizeAdapter adapter = new BatchSizeAdapter(10, 1, 100, 0.2, 0.3, 0.2, 3, 10, false);
        for (int i = 0; i < 20; i++) {
            assertFalse(adapter.record(5.0));
        }
        assertEquals(10, adapter.getCurrentBatchSize());
        assertEquals(10, adapter.getWindowDepth());
        assertEquals(OptionalInt.empty(), adapter.evaluate());
    }

    @Test
    @DisplayName("Minimum samples never exceed the window capacity")
    void minSamples_cappedByWindow() {
        BatchSizeAdapter adapter = new BatchSizeAdapter(20, 1, 100, 0.2, 0.3, 0.2, 5, 2, true);
        assertFalse(adapter.record(0.8));
        assertTrue(adapter.record(0.8));
    }

    @Test
    @DisplayName("Initial size is clipped into bounds")
    void initialSize_clipped() {
        assertEquals(50, adapter(500, 1, 50).getCurrentBatchSize());
        assertEquals(4, adapter(2, 4, 50).getCurrentBatchSize());
    }

    @Test
    @DisplayName("Manual adjust clips and counts only real changes")
    void adjust_clipsAndCounts() {
        BatchSizeAdapter adapter = adapter(10, 2, 20);
        assertTrue(adapter.adjust(100));
        assertEquals(20, adapter.getCurrentBatchSize());
        assertFalse(adapter.adjust(25));
        assertEquals(1, adapter.getAdaptationCount());
    }

    // ============================================================================
    // Validation
    // ============================================================================

    @Test
    @DisplayName("Invalid bounds are rejected")
    void invalidBounds_rejected() {
        assertThrows(ConfigurationException.class, () -> adapter(10, 0, 10));
        assertThrows(ConfigurationException.class, () -> adapter(10, 8, 4));
        assertThrows(ConfigurationException.class, () -> adapter(0, 1, 10));
    }

    @ParameterizedTest(name = "rate={0}")
    @ValueSource(doubles = {-0.1, 1.5})
    @DisplayName("Adaptation rate outside [0, 1] is rejected")
    void invalidRate_rejected(double rate) {
        assertThrows(ConfigurationException.class,
                () -> new BatchSizeAdapter(10, 1, 100, 0.2, rate, 0.2, 3, 10, true));
    }

    @Test
    @DisplayName("Non-positive target and empty window are rejected")
    void invalidTargetAndWindow_rejected() {
        assertThrows(ConfigurationException.class,
                () -> new BatchSizeAdapter(10, 1, 100, 0.0, 0.3, 0.2, 3, 10, true));
        assertThrows(ConfigurationException.class,
                () -> new BatchSizeAdapter(10, 1, 100, 0.2, 0.3, 0.2, 3, 0, true));
        assertThrows(ConfigurationException.class,
                () -> new BatchSizeAdapter(10, 1, 100, 0.2, 0.3, -0.1, 3, 10, true));
    }
}
