package com.di.chunkpilot.worker;

/**
 * How a worker comes into existence, with the plausibility bounds and static estimate used
 * when the measured creation cost cannot be trusted. All values in seconds.
 */
public enum WorkerCreationStrategy {

    /** A dedicated platform (OS) thread per worker. */
    PLATFORM_THREAD(0.000_005, 0.05, 0.000_2),
    /** A work-stealing {@link java.util.concurrent.ForkJoinPool} worker. */
    FORK_JOIN(0.000_005, 0.1, 0.001),
    /** A child JVM process speaking the isolated worker protocol. */
    CHILD_JVM(0.02, 5.0, 0.5);

    private final double minPlausibleSeconds;
    private final double maxPlausibleSeconds;
    private final double estimateSeconds;

    WorkerCreationStrategy(double minPlausibleSeconds, double maxPlausibleSeconds, double estimateSeconds) {
        this.minPlausibleSeconds = minPlausibleSeconds;
        this.maxPlausibleSeconds = maxPlausibleSeconds;
        this.estimateSeconds = estimateSeconds;
    }

    public boolean isPlausible(double seconds) {
        return Double.isFinite(seconds) && seconds >= minPlausibleSeconds && seconds <= maxPlausibleSeconds;
    }

    public double getMinPlausibleSeconds() {
        return minPlausibleSeconds;
    }

    public double getMaxPlausibleSeconds() {
        return maxPlausibleSeconds;
    }

    public double getEstimateSeconds() {
        return estimateSeconds;
    }
}
