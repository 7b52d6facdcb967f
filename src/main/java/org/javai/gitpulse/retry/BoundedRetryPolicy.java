package org.javai.gitpulse.retry;

import org.javai.gitpulse.ApiFailure;

import java.time.Duration;
import java.util.Objects;

/**
 * A policy that retries retriable failures until {@code maxAttempts} attempts were made.
 * Subclasses choose the delay.
 */
abstract class BoundedRetryPolicy implements RetryPolicy {

    private final String id;
    private final int maxAttempts;

    BoundedRetryPolicy(String id, int maxAttempts) {
        this.id = Objects.requireNonNull(id);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    abstract Duration delayFor(RetryContext context);

    @Override
    public String id() {
        return id;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public RetryDecision decide(RetryContext context, ApiFailure failure) {
        if (!failure.retriable()) {
            return RetryDecision.terminal(failure.code() + " is not retriable");
        }
        if (context.attemptNumber() >= maxAttempts) {
            return RetryDecision.exhausted(context.attemptNumber());
        }
        return RetryDecision.retryAfter(delayFor(context));
    }
}
