package com.di.chunkpilot.exception;

import java.util.List;

/**
 * Every sampled item raised. Partial failures never produce this exception; they are
 * recorded on the sample result and excluded from timing statistics.
 */
public class SamplingFailureException extends ChunkPilotException {

    private final List<Throwable> failures;
    private final transient Iterable<?> dataset;

    public SamplingFailureException(int sampled, List<Throwable> failures) {
        this(sampled, failures, null);
    }

    public SamplingFailureException(int sampled, List<Throwable> failures, Iterable<?> dataset) {
        super("All " + sampled + " sampled items failed; first error: "
                + (failures.isEmpty() ? "n/a" : failures.get(0).toString()),
                failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
        this.dataset = dataset;
    }

    public List<Throwable> getFailures() {
        return failures;
    }

    /** The full dataset (sampled head included) so callers can still run it serially; may be null. */
    public Iterable<?> getDataset() {
        return dataset;
    }
}
