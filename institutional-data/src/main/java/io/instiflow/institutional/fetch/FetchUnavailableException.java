package io.instiflow.institutional.fetch;

import java.io.IOException;

/**
 * A source had nothing usable for the requested date: the request failed, or the response was too
 * small to hold a table.
 */
public class FetchUnavailableException extends IOException {
    public FetchUnavailableException(String message) {
        super(message);
    }

    public FetchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
