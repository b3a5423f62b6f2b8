package io.instiflow.institutional.fetch;

import java.util.Map;

/**
 * Downloads one publisher export.
 */
@FunctionalInterface
public interface PublisherClient {
    /**
     * @param description label used in log lines, e.g. "TWSE 外資 2024-01-02"
     * @return the raw response body
     */
    byte[] get(String url, Map<String, String> query, String description)
            throws FetchUnavailableException, InterruptedException;
}
