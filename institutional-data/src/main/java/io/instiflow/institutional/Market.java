package io.instiflow.institutional;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Venue a tracked security trades on. Decides which publisher's tables apply and where its files live.
 */
public enum Market {
    LISTED("上市", "twse_raw"),
    OTC("上櫃", "tpex_raw");

    private final String label;
    private final String directoryName;

    Market(String label, String directoryName) {
        this.label = label;
        this.directoryName = directoryName;
    }

    /** Membership label as written in the tracked-security list. */
    public String label() { return label; }

    public Path directory(Path dataDir) { return dataDir.resolve(directoryName); }

    public static Optional<Market> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String trimmed = label.trim();
        for (Market m : values()) {
            if (m.label.equals(trimmed)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
