package com.di.chunkpilot.agent.adaptive;

import com.di.chunkpilot.exception.ConfigurationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;

/**
 * Exponential-smoothing batch size feedback: observe a batch duration, evaluate the window
 * average against the target, adjust the size. Not thread-safe; the controller serializes calls.
 *
 * <p>{@code newSize = round(current * (1 + rate * (target / average - 1)))}, clipped to
 * {@code [minBatch, maxBatch]}. Nothing happens until the window holds {@code minSamples}
 * durations, nor while the average stays within {@code tolerance} of the target.
 *
 * <p>Every size change empties the window: durations observed at the old size say nothing
 * about the new one, so the next decision waits for {@code minSamples} fresh batches.
 */
public class BatchSizeAdapter {

    private final int minBatch;
    private final int maxBatch;
    private final double targetSeconds;
    private final double adaptationRate;
    private final double tolerance;
    private final int minSamples;
    private final int windowCapacity;
    private final boolean enabled;
    private final Deque<Double> window;

    private double windowSum;
    private int currentBatchSize;
    private long adaptationCount;

    public BatchSizeAdapter(int initialBatchSize, int minBatch, int maxBatch, double targetSeconds,
                            double adaptationRate, double tolerance, int minSamples, int windowCapacity,
                            boolean enabled) {
        ConfigurationException.require(minBatch >= 1, "minBatch must be >= 1, got " + minBatch);
        ConfigurationException.require(maxBatch >= minBatch,
                "maxBatch (" + maxBatch + ") must be >= minBatch (" + minBatch + ")");
        ConfigurationException.require(adaptationRate >= 0.0 && adaptationRate <= 1.0,
                "adaptationRate must be in [0, 1], got " + adaptationRate);
        ConfigurationException.require(targetSeconds > 0.0, "targetChunkSeconds must be > 0, got " + targetSeconds);
        ConfigurationException.require(tolerance >= 0.0, "tolerance must be >= 0, got " + tolerance);
        ConfigurationException.require(windowCapacity >= 1, "windowSize must be >= 1, got " + windowCapacity);
        ConfigurationException.require(minSamples >= 1, "minSamples must be >= 1, got " + minSamples);
        ConfigurationException.require(initialBatchSize >= 1, "initial batch size must be >= 1, got " + initialBatchSize);
        this.minBatch = minBatch;
        this.maxBatch = maxBatch;
        this.targetSeconds = targetSeconds;
        this.adaptationRate = adaptationRate;
        this.tolerance = tolerance;
        this.minSamples = Math.min(minSamples, windowCapacity);
        this.windowCapacity = windowCapacity;
        this.enabled = enabled;
        this.window = new ArrayDeque<>(windowCapacity);
        this.currentBatchSize = clip(initialBatchSize);
    }

    /**
     * Full cycle for one completed batch.
     *
     * @return true when the batch size changed
     */
    public boolean record(double durationSeconds) {
        observe(durationSeconds);
        OptionalInt proposed = evaluate();
        return proposed.isPresent() && adjust(proposed.getAsInt());
    }

    /** Appends to the window, evicting the oldest entry when full. */
    public void observe(double durationSeconds) {
        if (window.size() == windowCapacity) {
            windowSum -= window.removeFirst();
        }
        window.addLast(durationSeconds);
        windowSum += durationSeconds;
    }

    /** The size the window average asks for, or empty when no change is warranted. */
    public OptionalInt evaluate() {
        if (!enabled || window.size() < minSamples) {
            return OptionalInt.empty();
        }
        double average = averageDuration();
        if (average <= 0.0 || Math.abs(average - targetSeconds) <= tolerance * targetSeconds) {
            return OptionalInt.empty();
        }
        double factor = 1.0 + adaptationRate * (targetSeconds / average - 1.0);
        long proposed = Math.round(currentBatchSize * factor);
        return OptionalInt.of(clip(proposed));
    }

    /**
     * Applies a proposal; counts as an adaptation only when the size actually changes, and
     * then starts a fresh window.
     */
    public boolean adjust(int proposed) {
        int next = clip(proposed);
        if (next == currentBatchSize) {
            return false;
        }
        currentBatchSize = next;
        adaptationCount++;
        window.clear();
        windowSum = 0.0;
        return true;
    }

    public double averageDuration() {
        return window.isEmpty() ? 0.0 : windowSum / window.size();
    }

    public int getCurrentBatchSize() {
        return currentBatchSize;
    }

    public long getAdaptationCount() {
        return adaptationCount;
    }

    public int getWindowDepth() {
        return window.size();
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public int getMinBatch() {
        return minBatch;
    }

    public int getMaxBatch() {
        return maxBatch;
    }

    public double getTargetSeconds() {
        return targetSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private int clip(long size) {
        return (int) Math.max(minBatch, Math.min(maxBatch, size));
    }
}
