package io.instiflow.institutional;

import com.codahale.metrics.MetricRegistry;
import io.instiflow.core.Record;
import io.instiflow.institutional.parse.CanonicalRow;
import io.instiflow.institutional.parse.ContentDecoder;
import io.instiflow.institutional.parse.MarketTable;
import io.instiflow.institutional.parse.TableMerger;
import io.instiflow.institutional.store.DailySnapshotStore;
import io.instiflow.institutional.store.HistoryAccumulator;
import io.instiflow.institutional.store.StorageLayout;
import io.instiflow.metrics.Metrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DayOrchestratorTest {
    static final LocalDate DAY = LocalDate.of(2024, 1, 2);
    static final String DAY_PARAM = "20240102";

    @TempDir
    Path dir;

    private final PublisherCatalog catalog = PublisherCatalog.defaults();
    private final SourceDefinition foreign = catalog.sources().get(0);
    private final SourceDefinition trust = catalog.sources().get(1);
    private final List<TrackedSecurity> securities = List.of(
            new TrackedSecurity("2330", Market.LISTED),
            new TrackedSecurity("2317", Market.LISTED),
            new TrackedSecurity("6488", Market.OTC));

    private FakePublisherClient client;
    private Metrics metrics;
    private StorageLayout layout;
    private SecurityDaySink sink;

    @BeforeEach
    void setUp() {
        client = new FakePublisherClient();
        metrics = new Metrics(new MetricRegistry());
        layout = new StorageLayout(dir);
        sink = new SecurityDaySink(new DailySnapshotStore(layout), new HistoryAccumulator(layout), metrics);
    }

    private DayOrchestrator orchestrator(int minPayloadBytes) {
        return new DayOrchestrator(catalog, client, new ContentDecoder(), new TableMerger(), securities,
                Duration.ZERO, minPayloadBytes, metrics);
    }

    @Test
    void foreign_rows_merged_with_empty_trust_table() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")))
              .serve(trust, DAY_PARAM, Fixtures.utf8(Fixtures.trustHeaderOnly()));

        MarketDay day = orchestrator(0).collect(DAY);
        MarketTable listed = day.table(Market.LISTED);
        List<CanonicalRow> rows = listed.rowsFor("2330");
        assertEquals(1, rows.size());
        CanonicalRow row = rows.get(0);
        assertEquals(10_000L, row.share("外資_買進股數"));
        assertEquals(4_000L, row.share("外資_賣出股數"));
        assertEquals(6_000L, row.share("外資_買賣超股數"));
        assertEquals(0L, row.share("投信_買進股數"));
        assertEquals(0L, row.share("投信_買賣超股數"));
        assertTrue(day.table(Market.OTC).isEmpty());
        // dealer and OTC sources were not served
        assertEquals(2, metrics.count(FlowMetrics.FETCH_UNAVAILABLE));
    }

    @Test
    void slices_only_securities_present_in_their_market() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")));

        List<Record<SecurityDaySlice>> out = orchestrator(0).apply(new Record<>(7, 0, DAY));
        assertEquals(2, out.size());
        assertEquals("2330", out.get(0).payload().security().securityId());
        assertEquals("2317", out.get(1).payload().security().securityId());
        assertEquals(7, out.get(1).seq());
        assertEquals(1, out.get(1).subSeq());
    }

    @Test
    void payload_below_threshold_is_unavailable() throws Exception {
        byte[] full = padTo(Fixtures.trust("2330"), 200);
        assertEquals(200, full.length);
        DayOrchestrator orchestrator = orchestrator(200);

        client.serve(trust, DAY_PARAM, Arrays.copyOf(full, 150));
        assertTrue(orchestrator.fetchAndParse(trust, DAY).isEmpty());
        assertEquals(1, metrics.count(FlowMetrics.FETCH_UNAVAILABLE));
        assertEquals(0, metrics.count(FlowMetrics.DECODE_FAILURES));

        client.serve(trust, DAY_PARAM, full);
        assertEquals(1, orchestrator.fetchAndParse(trust, DAY).orElseThrow().rows().size());
    }

    @Test
    void undecodable_payload_drops_only_that_source() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")))
              .serve(trust, DAY_PARAM, new byte[]{(byte) 0x81, 0x20});

        MarketDay day = orchestrator(0).collect(DAY);
        assertEquals(1, metrics.count(FlowMetrics.DECODE_FAILURES));
        assertEquals(1, day.table(Market.LISTED).rowsFor("2330").size());
        assertFalse(day.table(Market.LISTED).fields().contains("投信_買進股數"));
    }

    @Test
    void day_without_any_data_emits_nothing() throws Exception {
        DayOrchestrator orchestrator = orchestrator(0);
        assertTrue(orchestrator.apply(new Record<>(0, 0, DAY)).isEmpty());
        assertEquals(1, metrics.count(FlowMetrics.DAYS_WITHOUT_DATA));
        assertEquals(4, client.requests.get());
    }

    @Test
    void run_day_writes_snapshot_then_history() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")));

        assertEquals(2, orchestrator(0).runDay(DAY, sink));
        assertTrue(Files.exists(layout.snapshotFile(Market.LISTED, "2330", DAY)));
        assertEquals(1, new HistoryAccumulator(layout).read(Market.LISTED, "2330").size());
        assertEquals("2024-01-02", new HistoryAccumulator(layout).read(Market.LISTED, "2317").rows().get(0).get("日期"));
        assertFalse(Files.exists(layout.securityDir(Market.OTC, "6488")));
    }

    @Test
    void rerun_with_existing_snapshot_writes_nothing() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")));
        orchestrator(0).runDay(DAY, sink);
        Path snapshot = layout.snapshotFile(Market.LISTED, "2317", DAY);
        Path history = layout.historyFile(Market.LISTED, "2317");
        byte[] snapshotBefore = Files.readAllBytes(snapshot);
        byte[] historyBefore = Files.readAllBytes(history);

        // the publisher now reports different numbers for the same date
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "1", "1", "0")
                .replace("\"2,000\",\"3,000\",\"-1,000\"", "\"9\",\"9\",\"0\"")));
        assertEquals(0, orchestrator(0).runDay(DAY, sink));

        assertArrayEquals(snapshotBefore, Files.readAllBytes(snapshot));
        assertArrayEquals(historyBefore, Files.readAllBytes(history));
        assertEquals(2, metrics.count(FlowMetrics.SNAPSHOTS_SKIPPED));
        assertTrue(new String(historyBefore, StandardCharsets.UTF_8).contains("-1000"));
    }

    @Test
    void persistence_failure_does_not_stop_other_securities() throws Exception {
        client.serve(foreign, DAY_PARAM, Fixtures.utf8(Fixtures.foreign("2330", "台積電", "10,000", "4,000", "6,000")));
        // a regular file where 2330's directory should be
        Files.createDirectories(layout.securityDir(Market.LISTED, "2330").getParent());
        Files.writeString(layout.securityDir(Market.LISTED, "2330"), "not a directory");

        assertEquals(1, orchestrator(0).runDay(DAY, sink));
        assertEquals(1, metrics.count(FlowMetrics.PERSIST_FAILURES));
        assertTrue(Files.exists(layout.snapshotFile(Market.LISTED, "2317", DAY)));
    }

    private static byte[] padTo(String text, int size) {
        byte[] body = Fixtures.utf8(text);
        assertTrue(body.length < size, "fixture already " + body.length + " bytes");
        return Fixtures.utf8(text + " ".repeat(size - body.length));
    }
}
