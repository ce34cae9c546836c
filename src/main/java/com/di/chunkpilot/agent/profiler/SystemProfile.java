package com.di.chunkpilot.agent.profiler;

import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Capacity snapshot of the machine the work will run on.
 */
@Value
@Builder(toBuilder = true)
public class SystemProfile {
    int physicalCores;
    int logicalCores;
    /** Memory that can still be allocated (host and container aware). */
    long availableMemoryBytes;
    long maxHeapBytes;
    WorkerCreationStrategy creationStrategy;
    /** Seconds to create and tear down one worker; always positive. */
    double spawnCostSeconds;
    /** False when the static estimate replaced the measurement. */
    boolean spawnCostMeasured;
    /** Fixed hand-off cost paid once per dispatched batch. */
    double dispatchOverheadSeconds;
    Instant measuredAt;
}
