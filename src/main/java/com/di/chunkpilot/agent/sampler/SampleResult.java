package com.di.chunkpilot.agent.sampler;

import com.di.chunkpilot.exception.TransferabilityException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a serial dry run over the head of a dataset revealed. Lives for one planning call.
 */
@Value
@Builder(toBuilder = true)
public class SampleResult {
    /** Total of a single-pass input that outlasted the sample and came without an expected count. */
    public static final long UNKNOWN_SIZE = -1L;

    @Singular
    List<ItemTiming> timings;
    @Singular
    List<ItemFailure> failures;
    /**
     * Total items in the dataset: exact, the caller's expectation for single-pass inputs, or
     * {@link #UNKNOWN_SIZE}.
     */
    long totalItems;
    double meanItemSeconds;
    /** Population stddev / mean of the wall times. */
    double coefficientOfVariation;
    WorkloadClass workloadClass;
    double avgItemBytes;
    double avgResultBytes;
    /** Serialize + deserialize cost of one item and its result. */
    double perItemTransferSeconds;
    double allocatedBytesPerItem;
    boolean transferable;
    TransferabilityException transferError;
    /** Threads the function uses internally; 1 when it does not fan out. */
    int internalThreads;
    Iterable<?> dataset;

    public boolean isEmpty() {
        return totalItems == 0;
    }

    public boolean isSizeKnown() {
        return totalItems >= 0;
    }

    public boolean allFailed() {
        return timings.isEmpty() && !failures.isEmpty();
    }

    /** Estimated serial run time; NaN when the size is unknown. */
    public double serialSeconds() {
        return isSizeKnown() ? meanItemSeconds * totalItems : Double.NaN;
    }

    /** The dataset to execute over; for single-pass inputs this is the reconstructed sequence. */
    @SuppressWarnings("unchecked")
    public <T> Iterable<T> getDataset() {
        return (Iterable<T>) dataset;
    }
}
