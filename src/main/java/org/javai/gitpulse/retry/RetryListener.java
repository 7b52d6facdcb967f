package org.javai.gitpulse.retry;

import org.javai.gitpulse.ApiFailure;

import java.time.Duration;

/**
 * Per-call hook notified before each backoff, so a caller can surface retry progress.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param failure The failure of the attempt that just ended
     * @param attemptNumber That attempt's number (1-based)
     * @param maxAttempts The attempt budget of the call
     * @param delay The wait before the next attempt
     */
    void beforeRetry(ApiFailure failure, int attemptNumber, int maxAttempts, Duration delay);

    static RetryListener none() {
        return (failure, attemptNumber, maxAttempts, delay) -> {};
    }
}
