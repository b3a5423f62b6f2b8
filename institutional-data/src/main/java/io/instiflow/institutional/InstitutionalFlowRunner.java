package io.instiflow.institutional;

import com.codahale.metrics.MetricRegistry;
import io.instiflow.error.FileDeadLetterSink;
import io.instiflow.institutional.store.HistoryAccumulator;
import io.instiflow.metrics.Metrics;
import io.instiflow.retry.RetryPolicy;
import io.instiflow.runtime.Pipeline;
import io.instiflow.runtime.PipelineBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a set of target dates through the pipeline: dates are collected on the worker pool, slices are
 * persisted by the single sink thread. Failed dates and failed writes go to the failure log.
 */
public class InstitutionalFlowRunner {
    private static final Logger log = LoggerFactory.getLogger(InstitutionalFlowRunner.class);
    private static final Duration PROGRESS_INTERVAL = Duration.ofSeconds(30);

    private final InstitutionalConfig config;
    private final DayOrchestrator orchestrator;
    private final SecurityDaySink sink;
    private final HistoryAccumulator history;
    private final List<TrackedSecurity> securities;
    private final MetricRegistry registry;
    private final Metrics metrics;

    public InstitutionalFlowRunner(InstitutionalConfig config,
                                   DayOrchestrator orchestrator,
                                   SecurityDaySink sink,
                                   HistoryAccumulator history,
                                   List<TrackedSecurity> securities,
                                   MetricRegistry registry) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.sink = sink;
        this.history = history;
        this.securities = List.copyOf(securities);
        this.registry = registry;
        this.metrics = new Metrics(registry);
    }

    public RunSummary run(List<LocalDate> dates) throws IOException, InterruptedException {
        Map<TrackedSecurity, Integer> before = historyRows();
        Map<String, Long> countsBefore = counts();

        Pipeline<LocalDate, SecurityDaySlice> pipeline = new PipelineBuilder<LocalDate, SecurityDaySlice>()
                .source(new TargetDateSource(dates))
                .transform(orchestrator)
                .sink(sink)
                .retry(RetryPolicy.none())
                .workers(config.workers())
                .queueCapacity(Math.max(16, dates.size()))
                .maxInFlight(config.workers())
                .metrics(registry)
                .deadLetterIn(new FileDeadLetterSink<>(config.failureLog()))
                .deadLetterOut(new FileDeadLetterSink<>(config.failureLog()))
                .build();

        log.info("Processing {} dates with {} workers", dates.size(), config.workers());
        pipeline.start();
        try {
            while (!pipeline.awaitCompletion(PROGRESS_INTERVAL)) {
                log.info("Still running: inflight={} queued={}", pipeline.getInflight(), pipeline.getQueueSize());
            }
        } finally {
            pipeline.close();
        }

        Map<TrackedSecurity, Integer> after = historyRows();
        List<RunSummary.SecurityCount> perSecurity = new ArrayList<>();
        for (TrackedSecurity s : securities) {
            perSecurity.add(new RunSummary.SecurityCount(s, before.get(s), after.get(s)));
        }
        Map<String, Long> countsAfter = counts();
        return new RunSummary(dates.size(), perSecurity,
                delta(FlowMetrics.SNAPSHOTS_WRITTEN, countsBefore, countsAfter),
                delta(FlowMetrics.SNAPSHOTS_SKIPPED, countsBefore, countsAfter),
                delta(FlowMetrics.FETCH_UNAVAILABLE, countsBefore, countsAfter),
                delta(FlowMetrics.PERSIST_FAILURES, countsBefore, countsAfter),
                delta(Pipeline.TRANSFORM_FAILURES, countsBefore, countsAfter));
    }

    private Map<String, Long> counts() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String name : List.of(FlowMetrics.SNAPSHOTS_WRITTEN, FlowMetrics.SNAPSHOTS_SKIPPED,
                FlowMetrics.FETCH_UNAVAILABLE, FlowMetrics.PERSIST_FAILURES, Pipeline.TRANSFORM_FAILURES)) {
            out.put(name, metrics.count(name));
        }
        return out;
    }

    private static long delta(String name, Map<String, Long> before, Map<String, Long> after) {
        return after.get(name) - before.get(name);
    }

    private Map<TrackedSecurity, Integer> historyRows() {
        Map<TrackedSecurity, Integer> rows = new LinkedHashMap<>();
        for (TrackedSecurity s : securities) {
            int n = 0;
            try {
                n = history.read(s.market(), s.securityId()).size();
            } catch (IOException e) {
                log.warn("Cannot read history of {}: {}", s.securityId(), e.getMessage());
            }
            rows.put(s, n);
        }
        return rows;
    }
}
