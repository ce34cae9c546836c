package com.di.chunkpilot.agent.sampler;

import com.di.chunkpilot.exception.SamplingFailureException;
import com.di.chunkpilot.exception.TransferabilityException;
import com.di.chunkpilot.util.SerializationSupport;
import com.di.chunkpilot.worker.SerializableFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Serial dry run over the head of a dataset: per-item wall and CPU time, variability,
 * workload class, transfer cost across the isolation boundary and nested-parallelism hints.
 *
 * <p>Collections are sampled in place. Any other {@link Iterable} is treated as single-pass and
 * handed back as a {@link ChainedDataset} on the result; its remainder is never read here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkloadSampler {

    private final SamplerProperties properties;

    public int defaultSampleSize() {
        return properties.getSampleSize();
    }

    public <T, R> SampleResult sample(SerializableFunction<T, R> fn, Iterable<T> dataset) {
        return sample(fn, dataset, properties.getSampleSize(), null);
    }

    public <T, R> SampleResult sample(SerializableFunction<T, R> fn, Iterable<T> dataset, int sampleSize) {
        return sample(fn, dataset, sampleSize, null);
    }

    /**
     * Samples the first {@code sampleSize} items.
     *
     * @param expectedItemCount item count of a single-pass input when the caller knows it; when null
     *                          and the input outlasts the sample, the total is
     *                          {@link SampleResult#UNKNOWN_SIZE}
     * @throws SamplingFailureException when every sampled item raised
     */
    public <T, R> SampleResult sample(SerializableFunction<T, R> fn, Iterable<T> dataset,
                                      int sampleSize, Long expectedItemCount) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1, got " + sampleSize);
        }
        List<T> head = new ArrayList<>(sampleSize);
        Iterable<?> reconstructed;
        long totalItems;
        if (dataset instanceof Collection<T> collection) {
            Iterator<T> it = collection.iterator();
            while (head.size() < sampleSize && it.hasNext()) {
                head.add(it.next());
            }
            reconstructed = collection;
            totalItems = collection.size();
        } else {
            Iterator<T> it = dataset.iterator();
            while (head.size() < sampleSize && it.hasNext()) {
                head.add(it.next());
            }
            ChainedDataset<T> chained = new ChainedDataset<>(head, it);
            reconstructed = chained;
            if (chained.isExhausted()) {
                totalItems = head.size();
            } else if (expectedItemCount != null) {
                totalItems = Math.max(head.size(), expectedItemCount);
            } else {
                totalItems = SampleResult.UNKNOWN_SIZE;
            }
        }

        SampleResult.SampleResultBuilder result = SampleResult.builder()
                .totalItems(totalItems)
                .dataset(reconstructed)
                .workloadClass(WorkloadClass.MIXED)
                .transferable(true)
                .internalThreads(1);
        if (head.isEmpty()) {
            log.debug("[SAMPLER] empty dataset");
            return result.build();
        }

        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        boolean cpuTime = threads.isCurrentThreadCpuTimeSupported();
        List<ItemTiming> timings = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>();
        List<T> succeededItems = new ArrayList<>();
        List<R> results = new ArrayList<>();
        long allocated = 0;
        int allocationSamples = 0;
        int internalThreads = 1;

        for (int i = 0; i < head.size(); i++) {
            T item = head.get(i);
            int threadsBefore = 0;
            if (i == 0) {
                threads.resetPeakThreadCount();
                threadsBefore = threads.getThreadCount();
            }
            long allocBefore = allocatedBytes();
            long cpuBefore = cpuTime ? threads.getCurrentThreadCpuTime() : 0L;
            long wallBefore = System.nanoTime();
            try {
                R out = fn.apply(item);
                long wall = System.nanoTime() - wallBefore;
                long cpu = cpuTime ? threads.getCurrentThreadCpuTime() - cpuBefore : wall;
                long allocAfter = allocatedBytes();
                if (allocBefore >= 0 && allocAfter >= 0) {
                    allocated += allocAfter - allocBefore;
                    allocationSamples++;
                }
                timings.add(new ItemTiming(i, wall / 1e9, cpu / 1e9));
                succeededItems.add(item);
                results.add(out);
            } catch (RuntimeException e) {
                log.debug("[SAMPLER] item {} raised {}", i, e.toString());
                failures.add(new ItemFailure(i, e));
            }
            if (i == 0) {
                int grown = threads.getPeakThreadCount() - threadsBefore;
                if (grown >= properties.getInternalThreadNoise()) {
                    internalThreads = grown;
                }
            }
        }

        if (timings.isEmpty()) {
            List<Throwable> errors = failures.stream().map(ItemFailure::error).toList();
            throw new SamplingFailureException(head.size(), errors, reconstructed);
        }

        result.timings(timings)
                .failures(failures)
                .meanItemSeconds(meanWallSeconds(timings))
                .coefficientOfVariation(computeVariability(timings))
                .workloadClass(classify(timings))
                .allocatedBytesPerItem(allocationSamples > 0 ? (double) allocated / allocationSamples : 0.0)
                .internalThreads(internalThreads);

        try {
            TransferCost transfer = checkTransferability(fn, succeededItems, results);
            result.avgItemBytes(transfer.avgItemBytes())
                    .avgResultBytes(transfer.avgResultBytes())
                    .perItemTransferSeconds(transfer.perItemSeconds());
        } catch (TransferabilityException e) {
            log.info("[SAMPLER] {} is not transferable: {}", e.getSubject(), e.getMessage());
            result.transferable(false).transferError(e);
        }

        SampleResult built = result.build();
        log.info("[SAMPLER] sampled={} failed={} total={} mean={}s cv={} class={} transfer={}s internalThreads={}",
                timings.size(), failures.size(), totalItems, String.format("%.6f", built.getMeanItemSeconds()),
                String.format("%.3f", built.getCoefficientOfVariation()), built.getWorkloadClass(),
                String.format("%.6f", built.getPerItemTransferSeconds()), internalThreads);
        return built;
    }

    /**
     * Coefficient of variation (population stddev / mean) of the wall times. Zero for fewer than
     * two timings or a zero mean.
     */
    public double computeVariability(List<ItemTiming> timings) {
        if (timings == null || timings.size() < 2) {
            return 0.0;
        }
        // Welford
        double mean = 0.0;
        double m2 = 0.0;
        int n = 0;
        for (ItemTiming t : timings) {
            n++;
            double x = t.wallTimeSeconds();
            double delta = x - mean;
            mean += delta / n;
            m2 += delta * (x - mean);
        }
        if (mean <= 0.0) {
            return 0.0;
        }
        return Math.sqrt(m2 / n) / mean;
    }

    public WorkloadClass classify(List<ItemTiming> timings) {
        if (timings == null || timings.isEmpty()) {
            return WorkloadClass.MIXED;
        }
        double ratio = timings.stream().mapToDouble(ItemTiming::cpuRatio).average().orElse(1.0);
        return WorkloadClass.fromCpuRatio(ratio);
    }

    /**
     * Round-trips the function, the item and its result through Java serialization.
     *
     * @throws TransferabilityException when any of them cannot cross the isolation boundary
     */
    public <T, R> TransferCost checkTransferability(SerializableFunction<T, R> fn, T item) {
        R result;
        try {
            result = fn.apply(item);
        } catch (RuntimeException e) {
            throw new TransferabilityException("result", e);
        }
        return checkTransferability(fn, Collections.singletonList(item), Collections.singletonList(result));
    }

    <T, R> TransferCost checkTransferability(SerializableFunction<T, R> fn, List<T> items, List<R> results) {
        try {
            SerializationSupport.roundTrip(fn);
        } catch (RuntimeException e) {
            throw new TransferabilityException("function", e);
        }
        long itemBytes = 0;
        long resultBytes = 0;
        long nanos = 0;
        for (int i = 0; i < items.size(); i++) {
            long start = System.nanoTime();
            itemBytes += roundTripBytes("item", items.get(i));
            resultBytes += roundTripBytes("result", results.get(i));
            nanos += System.nanoTime() - start;
        }
        int n = Math.max(1, items.size());
        return new TransferCost((double) itemBytes / n, (double) resultBytes / n, nanos / 1e9 / n);
    }

    private static long roundTripBytes(String subject, Object value) {
        try {
            byte[] bytes = SerializationSupport.toBytes(value);
            SerializationSupport.fromBytes(bytes);
            return bytes.length;
        } catch (RuntimeException e) {
            throw new TransferabilityException(subject, e);
        }
    }

    private static double meanWallSeconds(List<ItemTiming> timings) {
        return timings.stream().mapToDouble(ItemTiming::wallTimeSeconds).average().orElse(0.0);
    }

    private static long allocatedBytes() {
        if (ManagementFactory.getThreadMXBean() instanceof com.sun.management.ThreadMXBean sun
                && sun.isThreadAllocatedMemorySupported() && sun.isThreadAllocatedMemoryEnabled()) {
            return sun.getCurrentThreadAllocatedBytes();
        }
        return -1L;
    }

    /** Average serialized sizes and the serialize + deserialize time of one item and its result. */
    public record TransferCost(double avgItemBytes, double avgResultBytes, double perItemSeconds) {}
}
