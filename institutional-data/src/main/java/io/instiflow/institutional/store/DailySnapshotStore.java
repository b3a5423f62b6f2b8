package io.instiflow.institutional.store;

import io.instiflow.institutional.Market;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Write-once files holding a security's rows for one date as first captured.
 */
public class DailySnapshotStore {
    private final StorageLayout layout;

    public DailySnapshotStore(StorageLayout layout) {
        this.layout = layout;
    }

    public boolean exists(Market market, String securityId, LocalDate date) {
        return Files.exists(layout.snapshotFile(market, securityId, date));
    }

    /**
     * @throws java.nio.file.FileAlreadyExistsException if the snapshot was already written
     */
    public Path write(Market market, String securityId, LocalDate date, CsvTable rows) throws IOException {
        Path file = layout.snapshotFile(market, securityId, date);
        CsvFiles.create(file, rows);
        return file;
    }

    public CsvTable read(Market market, String securityId, LocalDate date) throws IOException {
        return CsvFiles.read(layout.snapshotFile(market, securityId, date));
    }
}
