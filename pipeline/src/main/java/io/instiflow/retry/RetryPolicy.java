package io.instiflow.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    /** Policy that gives up after the first attempt. */
    static RetryPolicy none() {
        return new ExponentialBackoffRetryPolicy(1, 1, 1);
    }
}
