package org.javai.gitpulse.ops;

import org.javai.gitpulse.ApiFailure;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every reported event for assertions.
 */
public class CapturingOpReporter implements OpReporter {

    public record RetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {}

    public record RetryExhausted(ApiFailure failure, int totalAttempts) {}

    public record QuotaLow(String operation, int remaining) {}

    public final List<ApiFailure> failures = new CopyOnWriteArrayList<>();
    public final List<RetryAttempt> retries = new CopyOnWriteArrayList<>();
    public final List<RetryExhausted> exhausted = new CopyOnWriteArrayList<>();
    public final List<QuotaLow> quotaLow = new CopyOnWriteArrayList<>();

    @Override
    public void report(ApiFailure failure) {
        failures.add(failure);
    }

    @Override
    public void reportRetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {
        retries.add(new RetryAttempt(failure, attemptNumber, delay));
    }

    @Override
    public void reportRetryExhausted(ApiFailure failure, int totalAttempts) {
        exhausted.add(new RetryExhausted(failure, totalAttempts));
    }

    @Override
    public void reportQuotaLow(String operation, int remaining) {
        quotaLow.add(new QuotaLow(operation, remaining));
    }
}
