package io.instiflow.core;

import java.io.Closeable;

/**
 * Consumes records in seq then subSeq order. Called from a single thread.
 */
@FunctionalInterface
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
