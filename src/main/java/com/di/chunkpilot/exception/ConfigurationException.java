package com.di.chunkpilot.exception;

/**
 * Thrown at construction time when bounds are inconsistent (e.g. {@code maxBatch < minBatch},
 * adaptation rate outside [0, 1], worker count below 1). Never retried.
 */
public class ConfigurationException extends ChunkPilotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}
