package org.javai.gitpulse.retry;

import org.javai.gitpulse.clock.Ticker;

import java.time.Duration;
import java.util.Objects;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptNumber The current attempt number (1-based)
 * @param startedAtNanos Ticker reading when the first attempt began
 * @param elapsed Time elapsed since the first attempt began
 */
public record RetryContext(int attemptNumber, long startedAtNanos, Duration elapsed) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Ticker ticker) {
        return new RetryContext(1, ticker.nanos(), Duration.ZERO);
    }

    public RetryContext next(Ticker ticker) {
        return new RetryContext(attemptNumber + 1, startedAtNanos,
                Duration.ofNanos(ticker.nanos() - startedAtNanos));
    }

    /**
     * The 0-based index of the current attempt.
     */
    public int attemptIndex() {
        return attemptNumber - 1;
    }
}
