package io.instiflow.institutional.fetch;

import io.instiflow.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link PublisherClient} over the JDK HTTP client. Transport errors and non-2xx answers surface as
 * {@link FetchUnavailableException} once the retry policy gives up.
 */
public class HttpPublisherClient implements PublisherClient {
    private static final Logger log = LoggerFactory.getLogger(HttpPublisherClient.class);

    private final HttpClient http;
    private final Duration timeout;
    private final String userAgent;
    private final RetryPolicy retry;

    public HttpPublisherClient(Duration timeout, String userAgent, RetryPolicy retry) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.retry = retry;
    }

    @Override
    public byte[] get(String url, Map<String, String> query, String description)
            throws FetchUnavailableException, InterruptedException {
        log.info("Downloading {}", description);
        HttpRequest req = HttpRequest.newBuilder(URI.create(withQuery(url, query)))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
                if (resp.statusCode() / 100 == 2) return resp.body();
                throw new FetchUnavailableException(description + ": HTTP " + resp.statusCode());
            } catch (IOException e) {
                if (!retry.shouldRetry(attempt, e)) {
                    log.error("Network error while downloading {}: {}", description, e.getMessage());
                    throw e instanceof FetchUnavailableException f
                            ? f
                            : new FetchUnavailableException(description + ": " + e.getMessage(), e);
                }
                long backoff = retry.backoffMillis(attempt);
                log.warn("Attempt {} for {} failed ({}), retrying in {} ms", attempt, description, e.getMessage(), backoff);
                Thread.sleep(backoff);
            }
        }
    }

    static String withQuery(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) return url;
        String qs = query.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + qs;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
