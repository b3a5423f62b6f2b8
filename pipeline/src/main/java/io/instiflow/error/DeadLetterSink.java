package io.instiflow.error;

import io.instiflow.core.Record;

/**
 * Receives records that a pipeline stage gave up on.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);

    @Override default void close() {}
}
