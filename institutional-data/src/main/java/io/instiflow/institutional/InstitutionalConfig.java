package io.instiflow.institutional;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run settings, read once at start-up. Each value comes from a system property, then the matching
 * environment variable, then the default.
 */
public record InstitutionalConfig(
        Path dataDir,
        Path stockList,
        int workers,
        long pacingMillis,
        int minPayloadBytes,
        long requestTimeoutSeconds,
        int fetchAttempts,
        String userAgent
) {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    public InstitutionalConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (pacingMillis < 0) throw new IllegalArgumentException("pacingMillis must be >= 0");
        if (minPayloadBytes < 0) throw new IllegalArgumentException("minPayloadBytes must be >= 0");
        if (fetchAttempts < 1) throw new IllegalArgumentException("fetchAttempts must be >= 1");
    }

    public static InstitutionalConfig fromEnv() {
        Path dataDir = Path.of(setting("instiflow.dataDir", "INSTIFLOW_DATA_DIR", "data"));
        Path stockList = Path.of(setting("instiflow.stockList", "INSTIFLOW_STOCK_LIST", "stock_list.csv"));
        int workers = Integer.parseInt(setting("instiflow.workers", "INSTIFLOW_WORKERS", "5"));
        long pacing = Long.parseLong(setting("instiflow.pacingMillis", "INSTIFLOW_PACING_MILLIS", "500"));
        int minPayload = Integer.parseInt(setting("instiflow.minPayloadBytes", "INSTIFLOW_MIN_PAYLOAD_BYTES", "200"));
        long timeout = Long.parseLong(setting("instiflow.timeoutSeconds", "INSTIFLOW_TIMEOUT_SECONDS", "15"));
        int attempts = Integer.parseInt(setting("instiflow.fetchAttempts", "INSTIFLOW_FETCH_ATTEMPTS", "1"));
        String userAgent = setting("instiflow.userAgent", "INSTIFLOW_USER_AGENT", DEFAULT_USER_AGENT);
        return new InstitutionalConfig(dataDir, stockList, workers, pacing, minPayload, timeout, attempts, userAgent);
    }

    public static InstitutionalConfig defaults(Path dataDir, Path stockList) {
        return new InstitutionalConfig(dataDir, stockList, 5, 500, 200, 15, 1, DEFAULT_USER_AGENT);
    }

    /** Copy with CLI overrides applied; null arguments keep the current value. */
    public InstitutionalConfig withOverrides(Path dataDir, Path stockList, Integer workers) {
        return new InstitutionalConfig(
                dataDir == null ? this.dataDir : dataDir,
                stockList == null ? this.stockList : stockList,
                workers == null ? this.workers : workers,
                pacingMillis, minPayloadBytes, requestTimeoutSeconds, fetchAttempts, userAgent);
    }

    public Duration pacing() { return Duration.ofMillis(pacingMillis); }
    public Duration requestTimeout() { return Duration.ofSeconds(requestTimeoutSeconds); }
    public Path failureLog() { return dataDir.resolve("failures.jsonl"); }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
