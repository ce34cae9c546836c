package com.di.chunkpilot.worker;

import com.di.chunkpilot.exception.ChunkPilotException;

/**
 * Failure reported back from an isolated worker. The original exception type and message are
 * preserved as text since the exception itself may not be serializable.
 */
public class IsolatedWorkerException extends ChunkPilotException {

    private final String remoteType;

    public IsolatedWorkerException(String remoteType, String message) {
        super(remoteType + ": " + message);
        this.remoteType = remoteType;
    }

    public String getRemoteType() {
        return remoteType;
    }
}
