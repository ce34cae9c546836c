package com.di.chunkpilot.exception;

/**
 * The unit-of-work function or a data item cannot cross the worker isolation boundary
 * (Java serialization round trip failed).
 *
 * <p>Caught by the planner and turned into a serial decision with reason
 * {@code NOT_TRANSFERABLE}.
 */
public class TransferabilityException extends ChunkPilotException {

    private final String subject;

    public TransferabilityException(String subject, Throwable cause) {
        super(subject + " cannot be transferred to an isolated worker: " + cause.getMessage(), cause);
        this.subject = subject;
    }

    /** One of {@code "function"}, {@code "item"}, {@code "result"} or {@code "batch"}. */
    public String getSubject() {
        return subject;
    }
}
