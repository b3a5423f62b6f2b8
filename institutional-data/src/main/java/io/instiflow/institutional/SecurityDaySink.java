package io.instiflow.institutional;

import io.instiflow.core.Record;
import io.instiflow.core.Sink;
import io.instiflow.institutional.store.CsvTable;
import io.instiflow.institutional.store.DailySnapshotStore;
import io.instiflow.institutional.store.HistoryAccumulator;
import io.instiflow.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;

/**
 * Persists slices: writes the date's snapshot, then folds it into the history. A slice whose snapshot
 * already exists is skipped without touching any file.
 */
public class SecurityDaySink implements Sink<SecurityDaySlice> {
    private static final Logger log = LoggerFactory.getLogger(SecurityDaySink.class);

    public enum Outcome { WRITTEN, ALREADY_CAPTURED }

    private final DailySnapshotStore snapshots;
    private final HistoryAccumulator history;
    private final Metrics metrics;

    public SecurityDaySink(DailySnapshotStore snapshots, HistoryAccumulator history, Metrics metrics) {
        this.snapshots = snapshots;
        this.history = history;
        this.metrics = metrics;
    }

    @Override
    public void accept(Record<SecurityDaySlice> record) throws IOException {
        try {
            persist(record.payload());
        } catch (IOException | RuntimeException e) {
            metrics.counter(FlowMetrics.PERSIST_FAILURES).inc();
            throw e;
        }
    }

    public Outcome persist(SecurityDaySlice slice) throws IOException {
        TrackedSecurity security = slice.security();
        if (snapshots.exists(security.market(), security.securityId(), slice.date())) {
            return skipped(slice);
        }
        CsvTable rows = slice.toCsvTable();
        try {
            snapshots.write(security.market(), security.securityId(), slice.date(), rows);
        } catch (FileAlreadyExistsException e) {
            // also raised when a directory on the path is a regular file
            if (!snapshots.exists(security.market(), security.securityId(), slice.date())) throw e;
            return skipped(slice);
        }
        metrics.counter(FlowMetrics.SNAPSHOTS_WRITTEN).inc();
        log.info("Saved new snapshot for {}", slice);
        history.accumulate(security.market(), security.securityId(), rows);
        metrics.counter(FlowMetrics.HISTORY_UPDATES).inc();
        return Outcome.WRITTEN;
    }

    private Outcome skipped(SecurityDaySlice slice) {
        metrics.counter(FlowMetrics.SNAPSHOTS_SKIPPED).inc();
        log.info("Snapshot for {} already exists, skipping", slice);
        return Outcome.ALREADY_CAPTURED;
    }
}
