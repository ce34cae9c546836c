package com.di.chunkpilot.worker;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * What crosses into an isolated worker: the function plus a private copy of the batch.
 */
record BatchRequest(SerializableFunction<Object, Object> fn, ArrayList<Object> items) implements Serializable {

    @SuppressWarnings("unchecked")
    static <T, R> BatchRequest of(SerializableFunction<T, R> fn, List<T> batch) {
        return new BatchRequest((SerializableFunction<Object, Object>) fn, new ArrayList<>(batch));
    }

    ArrayList<Object> apply() {
        ArrayList<Object> results = new ArrayList<>(items.size());
        for (Object item : items) {
            results.add(fn.apply(item));
        }
        return results;
    }
}
