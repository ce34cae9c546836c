package com.di.chunkpilot.exception;

/**
 * Base type for all errors raised by the planner, sampler and adaptive controller.
 */
public class ChunkPilotException extends RuntimeException {

    public ChunkPilotException(String message) {
        super(message);
    }

    public ChunkPilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
