package com.di.chunkpilot.worker;

import java.io.Serializable;
import java.util.ArrayList;

/**
 * What comes back from an isolated worker: either results or the failure description.
 */
record BatchResponse(ArrayList<Object> results, String errorType, String errorMessage) implements Serializable {

    static BatchResponse success(ArrayList<Object> results) {
        return new BatchResponse(results, null, null);
    }

    static BatchResponse failure(Throwable error) {
        return new BatchResponse(null, error.getClass().getName(), String.valueOf(error.getMessage()));
    }

    boolean failed() {
        return errorType != null;
    }
}
