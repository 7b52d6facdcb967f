package org.javai.gitpulse.retry;

import org.javai.gitpulse.ApiFailure;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failed attempt.
 * A failure that is not {@link ApiFailure#retriable() retriable} is never retried.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * The total number of attempts this policy allows, the first one included.
     */
    int maxAttempts();

    RetryDecision decide(RetryContext context, ApiFailure failure);

    static RetryPolicy noRetry() {
        return fixed("no-retry", 1, Duration.ZERO);
    }

    /**
     * Retries with the same delay between every pair of attempts.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(delay);
        return new BoundedRetryPolicy(id, maxAttempts) {
            @Override
            Duration delayFor(RetryContext context) {
                return delay;
            }
        };
    }

    /**
     * Retries with delay {@code baseDelay × 2^attemptIndex}, capped at {@code maxDelay}.
     * With a 1s base the waits are 1s, 2s, 4s, ...
     */
    static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration baseDelay, Duration maxDelay) {
        Objects.requireNonNull(baseDelay);
        Objects.requireNonNull(maxDelay);
        return new BoundedRetryPolicy(id, maxAttempts) {
            @Override
            Duration delayFor(RetryContext context) {
                int shift = Math.min(context.attemptIndex(), 30);
                Duration delay = baseDelay.multipliedBy(1L << shift);
                return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
            }
        };
    }
}
