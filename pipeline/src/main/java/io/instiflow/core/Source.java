package io.instiflow.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * Produces records for a pipeline. Records must be numbered with consecutive seq values starting at 0,
 * the sink releases outputs in that order.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record if one is ready. Empty either means "nothing right now" or "done"; {@link #isFinished()}
     * tells the two apart.
     */
    Optional<Record<T>> poll();

    boolean isFinished();

    @Override
    default void close() {}
}
