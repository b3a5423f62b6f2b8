package io.instiflow.institutional;

public final class FlowMetrics {
    public static final String FETCH_REQUESTS = "flow.fetch.requests";
    public static final String FETCH_UNAVAILABLE = "flow.fetch.unavailable";
    public static final String DECODE_FAILURES = "flow.decode.failures";
    public static final String UNKEYED_TABLES = "flow.parse.unkeyed";
    public static final String DAYS_WITHOUT_DATA = "flow.days.noData";
    public static final String SNAPSHOTS_WRITTEN = "flow.snapshots.written";
    public static final String SNAPSHOTS_SKIPPED = "flow.snapshots.skipped";
    public static final String HISTORY_UPDATES = "flow.history.updates";
    public static final String PERSIST_FAILURES = "flow.persist.failures";

    private FlowMetrics() {}
}
