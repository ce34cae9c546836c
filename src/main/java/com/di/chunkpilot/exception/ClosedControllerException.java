package com.di.chunkpilot.exception;

/**
 * Raised by any submission to an adaptive controller (or worker pool) after
 * {@code close()} or {@code terminate()}.
 */
public class ClosedControllerException extends ChunkPilotException {

    public ClosedControllerException(String state) {
        super("Controller is " + state + "; no further submissions are accepted");
    }
}
