package io.instiflow.runtime;

import com.codahale.metrics.MetricRegistry;
import io.instiflow.core.Record;
import io.instiflow.core.Source;
import io.instiflow.core.Transform;
import io.instiflow.error.DeadLetterSink;
import io.instiflow.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineTest {
    private Pipeline<Integer, Integer> pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.close();
    }

    static class ListSource implements Source<Integer> {
        private final List<Integer> data;
        private int idx = 0;
        ListSource(List<Integer> data) { this.data = data; }
        @Override public synchronized Optional<Record<Integer>> poll() {
            if (idx >= data.size()) return Optional.empty();
            Record<Integer> r = new Record<>(idx, 0, data.get(idx));
            idx++;
            return Optional.of(r);
        }
        @Override public synchronized boolean isFinished() { return idx >= data.size(); }
    }

    static class CollectingDeadLetters<T> implements DeadLetterSink<T> {
        final List<String> stages = new CopyOnWriteArrayList<>();
        @Override public void acceptFailure(String stage, Record<T> record, Exception e) { stages.add(stage + ":" + record.payload()); }
    }

    @Test
    void outputs_reach_sink_in_source_order() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        // later records finish first
        Transform<Integer, Integer> slowFirst = r -> {
            Thread.sleep(50L - r.payload() * 10L);
            return List.of(new Record<>(r.seq(), 0, r.payload() * 10));
        };
        pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource(List.of(0, 1, 2, 3, 4)))
                .transform(slowFirst)
                .sink(r -> seen.add(r.payload()))
                .workers(5)
                .queueCapacity(8)
                .metrics(new MetricRegistry())
                .build();
        pipeline.start();

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(List.of(0, 10, 20, 30, 40), seen);
    }

    @Test
    void failed_record_is_reported_and_does_not_block_later_ones() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CollectingDeadLetters<Integer> dlq = new CollectingDeadLetters<>();
        Transform<Integer, Integer> failOnTwo = r -> {
            if (r.payload() == 2) throw new IllegalStateException("boom");
            return List.of(new Record<>(r.seq(), 0, r.payload()));
        };
        pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource(List.of(1, 2, 3)))
                .transform(failOnTwo)
                .sink(r -> seen.add(r.payload()))
                .deadLetterIn(dlq)
                .workers(2)
                .build();
        pipeline.start();

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(List.of(1, 3), seen);
        assertEquals(List.of("transform:2"), dlq.stages);
    }

    @Test
    void transient_transform_failure_is_retried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        Transform<Integer, Integer> flaky = r -> {
            if (calls.incrementAndGet() == 1) throw new IOException("transient");
            return List.of(new Record<>(r.seq(), 0, r.payload()));
        };
        pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource(List.of(7)))
                .transform(flaky)
                .sink(r -> seen.add(r.payload()))
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 10))
                .workers(1)
                .build();
        pipeline.start();

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(2, calls.get());
        assertEquals(List.of(7), seen);
    }

    @Test
    void sink_failure_only_skips_that_record() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CollectingDeadLetters<Integer> dlq = new CollectingDeadLetters<>();
        Transform<Integer, Integer> fanOut = r -> List.of(
                new Record<>(r.seq(), 0, r.payload()),
                new Record<>(r.seq(), 1, r.payload() + 100));
        pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource(List.of(1, 2)))
                .transform(fanOut)
                .sink(r -> {
                    if (r.payload() == 101) throw new IOException("disk full");
                    seen.add(r.payload());
                })
                .deadLetterOut(dlq)
                .workers(2)
                .build();
        pipeline.start();

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(List.of(1, 2, 102), seen);
        assertEquals(List.of("sink:101"), dlq.stages);
    }

    @Test
    void empty_source_completes() throws Exception {
        pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource(List.of()))
                .transform(r -> List.of(r))
                .sink(r -> fail("nothing expected"))
                .build();
        pipeline.start();
        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(5)));
        assertTrue(pipeline.isDone());
    }
}
