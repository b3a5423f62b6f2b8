package io.instiflow.runtime;

import com.codahale.metrics.MetricRegistry;
import io.instiflow.core.Sink;
import io.instiflow.core.Source;
import io.instiflow.core.Transform;
import io.instiflow.error.DeadLetterSink;
import io.instiflow.metrics.Metrics;
import io.instiflow.retry.RetryPolicy;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private int workers = 4;
    private int queueCapacity = 1024;
    private int maxInFlight = 1024;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> dlqIn;
    private DeadLetterSink<O> dlqOut;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = w; return this; }
    public PipelineBuilder<I, O> queueCapacity(int c) { this.queueCapacity = c; return this; }
    public PipelineBuilder<I, O> maxInFlight(int n) { this.maxInFlight = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> deadLetterIn(DeadLetterSink<I> d) { this.dlqIn = d; return this; }
    public PipelineBuilder<I, O> deadLetterOut(DeadLetterSink<O> d) { this.dlqOut = d; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        return new Pipeline<>(source, transform, sink, retryPolicy, workers, queueCapacity, maxInFlight,
                new Metrics(metricRegistry), dlqIn, dlqOut);
    }
}
