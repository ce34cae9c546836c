package com.di.chunkpilot.exception;

/**
 * A dispatched batch failed inside a worker. Carries the original cause.
 */
public class BatchExecutionException extends ChunkPilotException {

    private final int batchIndex;

    public BatchExecutionException(int batchIndex, Throwable cause) {
        super("Batch " + batchIndex + " failed: " + cause.getMessage(), cause);
        this.batchIndex = batchIndex;
    }

    public int getBatchIndex() {
        return batchIndex;
    }
}
