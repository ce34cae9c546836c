package com.di.chunkpilot.agent.execution;

import com.di.chunkpilot.agent.adaptive.AdaptiveStats;
import com.di.chunkpilot.agent.planner.Decision;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a one-call execution: results in input order, the plan they ran under and the
 * controller's state at the end of the run.
 */
@Value
public class ExecutionResult<R> {
    List<R> results;
    Decision decision;
    /** Null when the decision ran serially on the calling thread. */
    AdaptiveStats stats;
    long durationMs;

    public boolean ranInParallel() {
        return stats != null;
    }
}
