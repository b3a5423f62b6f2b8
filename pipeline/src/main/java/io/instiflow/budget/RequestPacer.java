package io.instiflow.budget;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps successive requests to one remote endpoint at least a fixed interval apart. Callers reserve the
 * next free slot atomically and sleep until it comes up, so concurrent callers are spaced too.
 */
public class RequestPacer {
    private final long intervalNanos;
    private final AtomicLong nextAvailableNanos = new AtomicLong(Long.MIN_VALUE);

    public RequestPacer(Duration interval) {
        this.intervalNanos = Math.max(0L, interval.toNanos());
    }

    public static RequestPacer unpaced() {
        return new RequestPacer(Duration.ZERO);
    }

    public Duration interval() { return Duration.ofNanos(intervalNanos); }

    /** Blocks until the caller may issue its request. */
    public void acquire() throws InterruptedException {
        if (intervalNanos == 0) return;
        long now = System.nanoTime();
        while (true) {
            long current = nextAvailableNanos.get();
            long earliest = current == Long.MIN_VALUE ? now : Math.max(current, now);
            long next = earliest + intervalNanos;
            if (nextAvailableNanos.compareAndSet(current, next)) {
                long delay = earliest - now;
                if (delay > 0) TimeUnit.NANOSECONDS.sleep(delay);
                return;
            }
        }
    }
}
