package io.instiflow.institutional;

import io.instiflow.budget.RequestPacer;
import io.instiflow.core.Record;
import io.instiflow.core.Transform;
import io.instiflow.institutional.fetch.FetchUnavailableException;
import io.instiflow.institutional.fetch.PublisherClient;
import io.instiflow.institutional.parse.CanonicalRow;
import io.instiflow.institutional.parse.CanonicalTable;
import io.instiflow.institutional.parse.ContentDecoder;
import io.instiflow.institutional.parse.DecodeException;
import io.instiflow.institutional.parse.MarketTable;
import io.instiflow.institutional.parse.TableMerger;
import io.instiflow.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns one target date into per-security slices: fetches every source of both markets, decodes, parses
 * and merges them per market, then picks each tracked security's rows. Sources that are unavailable,
 * undecodable or unparsable are dropped for that date; the remaining sources still produce output.
 * Persisting the slices is left to {@link SecurityDaySink}.
 */
public class DayOrchestrator implements Transform<LocalDate, SecurityDaySlice> {
    private static final Logger log = LoggerFactory.getLogger(DayOrchestrator.class);

    private final PublisherCatalog catalog;
    private final PublisherClient client;
    private final ContentDecoder decoder;
    private final TableMerger merger;
    private final List<TrackedSecurity> securities;
    private final Duration pacing;
    private final int minPayloadBytes;
    private final Metrics metrics;
    private final Map<String, RequestPacer> pacers = new ConcurrentHashMap<>();

    public DayOrchestrator(PublisherCatalog catalog,
                           PublisherClient client,
                           ContentDecoder decoder,
                           TableMerger merger,
                           List<TrackedSecurity> securities,
                           Duration pacing,
                           int minPayloadBytes,
                           Metrics metrics) {
        this.catalog = catalog;
        this.client = client;
        this.decoder = decoder;
        this.merger = merger;
        this.securities = List.copyOf(securities);
        this.pacing = pacing;
        this.minPayloadBytes = minPayloadBytes;
        this.metrics = metrics;
    }

    @Override
    public List<Record<SecurityDaySlice>> apply(Record<LocalDate> input) throws InterruptedException {
        List<SecurityDaySlice> slices = slice(collect(input.payload()));
        List<Record<SecurityDaySlice>> out = new ArrayList<>(slices.size());
        for (int i = 0; i < slices.size(); i++) {
            out.add(new Record<>(input.seq(), i, slices.get(i)));
        }
        return out;
    }

    /**
     * Runs one date without the pipeline: collects, slices and persists each slice in turn. A slice that
     * fails to persist is logged and the remaining securities still go through.
     *
     * @return number of securities whose snapshot was newly written
     */
    public int runDay(LocalDate date, SecurityDaySink sink) throws InterruptedException {
        int written = 0;
        for (SecurityDaySlice slice : slice(collect(date))) {
            try {
                if (sink.persist(slice) == SecurityDaySink.Outcome.WRITTEN) written++;
            } catch (IOException e) {
                metrics.counter(FlowMetrics.PERSIST_FAILURES).inc();
                log.error("Failed to persist {}", slice, e);
            }
        }
        return written;
    }

    /** Fetch, decode, parse and merge every source for {@code date}. */
    public MarketDay collect(LocalDate date) throws InterruptedException {
        Map<Market, MarketTable> tables = new EnumMap<>(Market.class);
        for (Market market : Market.values()) {
            List<CanonicalTable> parsed = new ArrayList<>();
            for (SourceDefinition source : catalog.sourcesFor(market)) {
                fetchAndParse(source, date).ifPresent(parsed::add);
            }
            tables.put(market, merger.merge(parsed));
        }
        MarketDay day = new MarketDay(date, tables);
        if (day.isEmpty()) {
            metrics.counter(FlowMetrics.DAYS_WITHOUT_DATA).inc();
            log.warn("{}: no market data could be retrieved", date);
        }
        return day;
    }

    /** Rows of each tracked security found in its market's table. */
    public List<SecurityDaySlice> slice(MarketDay day) {
        List<SecurityDaySlice> out = new ArrayList<>();
        for (TrackedSecurity security : securities) {
            MarketTable table = day.table(security.market());
            if (table.isEmpty()) continue;
            List<CanonicalRow> rows = table.rowsFor(security.securityId());
            if (rows.isEmpty()) {
                log.debug("{}: {} not present in the {} table", day.date(), security.securityId(), security.market());
                continue;
            }
            out.add(new SecurityDaySlice(security, day.date(), table.fields(), rows));
        }
        return out;
    }

    Optional<CanonicalTable> fetchAndParse(SourceDefinition source, LocalDate date) throws InterruptedException {
        String description = source.describe(date);
        byte[] payload;
        try {
            pacers.computeIfAbsent(source.publisher(), p -> new RequestPacer(pacing)).acquire();
            metrics.counter(FlowMetrics.FETCH_REQUESTS).inc();
            payload = client.get(source.url(), source.queryFor(date), description);
            int size = payload == null ? 0 : payload.length;
            if (size < minPayloadBytes) {
                throw new FetchUnavailableException(description + " returned " + size + " bytes, probably no trading data");
            }
        } catch (FetchUnavailableException e) {
            metrics.counter(FlowMetrics.FETCH_UNAVAILABLE).inc();
            log.warn("{} unavailable: {}", description, e.getMessage());
            return Optional.empty();
        }

        String text;
        try {
            text = decoder.decode(payload).text();
        } catch (DecodeException e) {
            metrics.counter(FlowMetrics.DECODE_FAILURES).inc();
            log.error("{}: {}", description, e.getMessage());
            return Optional.empty();
        }

        CanonicalTable table = source.parser().parse(text, description);
        if (!table.keyed()) {
            metrics.counter(FlowMetrics.UNKEYED_TABLES).inc();
            log.warn("{}: no table header found", description);
            return Optional.empty();
        }
        log.info("{}: parsed {} rows", description, table.rows().size());
        return Optional.of(table);
    }
}
