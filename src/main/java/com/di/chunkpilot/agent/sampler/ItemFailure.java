package com.di.chunkpilot.agent.sampler;

/** A sampled item whose execution raised. */
public record ItemFailure(int itemIndex, Throwable error) {
}
