package io.instiflow.institutional.store;

import io.instiflow.institutional.Market;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * {@code <dataDir>/<market dir>/<id>/<yyyy-MM-dd>.csv} for snapshots and {@code .../<id>/<id>.csv} for
 * the history.
 */
public final class StorageLayout {
    private final Path dataDir;

    public StorageLayout(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path dataDir() { return dataDir; }

    public Path securityDir(Market market, String securityId) {
        return market.directory(dataDir).resolve(securityId);
    }

    public Path snapshotFile(Market market, String securityId, LocalDate date) {
        return securityDir(market, securityId).resolve(date + ".csv");
    }

    public Path historyFile(Market market, String securityId) {
        return securityDir(market, securityId).resolve(securityId + ".csv");
    }
}
