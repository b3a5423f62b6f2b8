package io.instiflow.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.instiflow.core.Record;
import io.instiflow.core.Sink;
import io.instiflow.core.Source;
import io.instiflow.core.Transform;
import io.instiflow.error.DeadLetterSink;
import io.instiflow.metrics.Metrics;
import io.instiflow.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-source -> single-transform -> single-sink pipeline. Transforms run on a fixed worker pool, the
 * sink runs on one thread and sees outputs in source order. A record whose transform keeps failing is
 * reported and skipped; it never blocks the records behind it.
 */
public class Pipeline<I, O> implements AutoCloseable {
    /** Records given up on by the transform, after retries. */
    public static final String TRANSFORM_FAILURES = "pipeline.transform.failures";
    /** Records the sink threw on. */
    public static final String SINK_FAILURES = "pipeline.sink.failures";

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final RetryPolicy retryPolicy;
    private final int workers;
    private final int maxInFlight;
    private final Metrics metrics;
    private final DeadLetterSink<I> dlqIn;
    private final DeadLetterSink<O> dlqOut;

    private final ExecutorService workerPool;
    private final ArrayBlockingQueue<Batch<O>> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Thread srcThread;
    private volatile Thread sinkThread;

    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Counter transformFailures;
    private final Counter sinkFailures;

    public Pipeline(Source<I> source,
                    Transform<I, O> transform,
                    Sink<O> sink,
                    RetryPolicy retryPolicy,
                    int workers,
                    int queueCapacity,
                    int maxInFlight,
                    Metrics metrics,
                    DeadLetterSink<I> dlqIn,
                    DeadLetterSink<O> dlqOut) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.metrics = Objects.requireNonNull(metrics);
        this.workers = Math.max(1, workers);
        this.maxInFlight = Math.max(1, maxInFlight);
        this.dlqIn = dlqIn;
        this.dlqOut = dlqOut;
        AtomicInteger threadIds = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(this.workers, r -> {
            Thread t = new Thread(r, "pipeline-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
        this.transformFailures = metrics.counter(TRANSFORM_FAILURES);
        this.sinkFailures = metrics.counter(SINK_FAILURES);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        srcThread = new Thread(this::runSource, "pipeline-source");
        srcThread.start();
        // single sink thread keeps the output order
        sinkThread = new Thread(this::runSink, "pipeline-sink");
        sinkThread.start();
    }

    /**
     * Waits until every record of a finite source went through the sink.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        running.set(false);
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st != null) { try { st.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        if (kt != null) { try { kt.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        workerPool.shutdown();
    }

    public boolean isDone() { return done.getCount() == 0; }
    public int getQueueSize() { return queue.size(); }
    public int getInflight() { return inflight.get(); }

    private void runSource() {
        try {
            while (running.get()) {
                if (inflight.get() >= maxInFlight) { sleepQuiet(1); continue; }
                Optional<Record<I>> next = source.poll();
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    sleepQuiet(1);
                    continue;
                }
                inMeter.mark();
                Record<I> in = next.get();
                inflight.incrementAndGet();
                workerPool.submit(() -> process(in));
            }
        } catch (RuntimeException e) {
            errorMeter.mark();
            log.error("Source failed, no further records will be read", e);
        }
        while (inflight.get() > 0) { sleepQuiet(5); }
        enqueue(Batch.poison());
    }

    private void process(Record<I> in) {
        List<Record<O>> outputs = List.of();
        try {
            int attempt = 0;
            while (true) {
                attempt++;
                try (Timer.Context ignored = transformTimer.time()) {
                    List<Record<O>> produced = transform.apply(in);
                    outputs = produced == null ? List.of() : new ArrayList<>(produced);
                    outputs.sort(Comparator.comparingInt(Record::subSeq));
                    break;
                } catch (Exception e) {
                    errorMeter.mark();
                    if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                    if (retryPolicy.shouldRetry(attempt, e)) {
                        log.warn("Transform of {} failed on attempt {}, retrying: {}", in.payload(), attempt, e.toString());
                        sleepQuiet(retryPolicy.backoffMillis(attempt));
                        continue;
                    }
                    log.error("Transform of {} failed after {} attempt(s)", in.payload(), attempt, e);
                    transformFailures.inc();
                    if (dlqIn != null) dlqIn.acceptFailure("transform", in, e);
                    break;
                }
            }
        } finally {
            // an empty batch still advances the sink's expected seq
            enqueue(Batch.of(in.seq(), outputs));
            inflight.decrementAndGet();
        }
    }

    private void runSink() {
        try {
            long expectedSeq = 0;
            TreeMap<Long, Batch<O>> pending = new TreeMap<>();
            while (true) {
                Batch<O> batch = queue.take();
                if (batch.isPoison()) {
                    // a source that skipped seq values leaves gaps; flush the rest in order
                    for (Batch<O> rest : pending.values()) emit(rest);
                    return;
                }
                pending.put(batch.seq, batch);
                Batch<O> ready;
                while ((ready = pending.remove(expectedSeq)) != null) {
                    emit(ready);
                    expectedSeq++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            done.countDown();
        }
    }

    private void emit(Batch<O> batch) {
        for (Record<O> next : batch.items) {
            try (Timer.Context ignored = sinkTimer.time()) {
                sink.accept(next);
                outMeter.mark();
            } catch (Exception e) {
                errorMeter.mark();
                log.error("Sink rejected {}", next.payload(), e);
                sinkFailures.inc();
                if (dlqOut != null) dlqOut.acceptFailure("sink", next, e);
            }
        }
    }

    private void enqueue(Batch<O> batch) {
        try {
            queue.put(batch);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            if (!queue.offer(batch)) log.error("Dropped batch seq={} after interrupt", batch.seq);
        }
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    @Override
    public void close() {
        stop();
        workerPool.shutdownNow();
        sink.close();
        source.close();
    }

    static final class Batch<T> {
        final long seq;
        final List<Record<T>> items;
        private final boolean poison;

        private Batch(long seq, List<Record<T>> items, boolean poison) {
            this.seq = seq; this.items = items; this.poison = poison;
        }
        static <T> Batch<T> of(long seq, List<Record<T>> items) { return new Batch<>(seq, items, false); }
        static <T> Batch<T> poison() { return new Batch<>(Long.MAX_VALUE, List.of(), true); }
        boolean isPoison() { return poison; }
    }
}
