package org.javai.gitpulse.ops;

import org.javai.gitpulse.ApiFailure;

import java.time.Duration;

/**
 * Reports API access events for operators: structured logs, metrics lines.
 * Reporting is advisory: implementations must not influence retry decisions or results.
 */
public interface OpReporter {

    /**
     * Reports a failure that ended a logical call.
     */
    void report(ApiFailure failure);

    /**
     * Reports that a transient failure will be retried.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The backoff before the next attempt
     */
    default void reportRetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {
    }

    /**
     * Reports that the attempt budget was used up.
     *
     * @param failure The final failure
     * @param totalAttempts The number of attempts made
     */
    default void reportRetryExhausted(ApiFailure failure, int totalAttempts) {
    }

    /**
     * Reports that the upstream quota reported by a response is running low.
     *
     * @param operation The request whose response carried the quota header
     * @param remaining Requests left in the upstream quota
     */
    default void reportQuotaLow(String operation, int remaining) {
    }

    static OpReporter noOp() {
        return failure -> {};
    }

    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
