package org.javai.gitpulse.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} wants done after a failed attempt: wait and try again, or stop.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Why a call stops being retried.
     */
    enum StopReason {
        /** The failure can not be cured by another attempt. */
        TERMINAL_FAILURE,
        /** The failure was transient but the attempt budget is used up. */
        ATTEMPTS_EXHAUSTED
    }

    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * @param reason Why the call stops
     * @param detail Human-readable explanation for logs
     */
    record GiveUp(StopReason reason, String detail) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(detail, "detail must not be null");
        }

        public boolean exhausted() {
            return reason == StopReason.ATTEMPTS_EXHAUSTED;
        }
    }

    static RetryDecision retryAfter(Duration delay) {
        return new Retry(delay);
    }

    static RetryDecision terminal(String detail) {
        return new GiveUp(StopReason.TERMINAL_FAILURE, detail);
    }

    static RetryDecision exhausted(int attempts) {
        return new GiveUp(StopReason.ATTEMPTS_EXHAUSTED, "gave up after " + attempts + " attempt(s)");
    }
}
