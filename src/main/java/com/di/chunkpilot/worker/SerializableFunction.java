package com.di.chunkpilot.worker;

import java.io.Serializable;
import java.util.function.Function;

/**
 * Single-argument unit of work. Serializable so it can cross into isolated workers;
 * lambdas assigned to this type are serializable automatically.
 */
@FunctionalInterface
public interface SerializableFunction<T, R> extends Function<T, R>, Serializable {
}
