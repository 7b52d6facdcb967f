package org.javai.gitpulse.retry;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.clock.Sleeper;
import org.javai.gitpulse.clock.Ticker;
import org.javai.gitpulse.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Executes an attempt function repeatedly according to a {@link RetryPolicy}.
 * Operates entirely over {@link CallOutcome} values: attempts report failure by returning
 * a {@code Fail}, and the loop branches on it.
 *
 * <p>Attempts are strictly sequential. Attempt {@code n + 1} starts only after attempt
 * {@code n} returned and its backoff elapsed. The returned outcome is always terminal:
 * a final failure is marked non-retriable and records the number of attempts made.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = new Retrier(reporter, Sleeper.system(), Ticker.system());
 * CallOutcome<ApiResponse> result = retrier.execute(
 *     "GET /repos/octocat/hello-world",
 *     RetryPolicy.exponentialBackoff("github-api", 3, Duration.ofSeconds(1), Duration.ofMinutes(1)),
 *     RetryListener.none(),
 *     context -> sendOnce(request, context)
 * );
 * }</pre>
 */
public final class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final OpReporter reporter;
    private final Sleeper sleeper;
    private final Ticker ticker;

    public Retrier(OpReporter reporter, Sleeper sleeper, Ticker ticker) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    /**
     * Executes an operation with retry according to the policy.
     *
     * @param operation The operation name, used in reporting and synthesized failures
     * @param policy Decides whether and when to retry
     * @param listener Notified before every backoff
     * @param attempt Performs one attempt; receives the context of that attempt
     * @return The outcome of the first successful attempt, or the final failure
     */
    public <T> CallOutcome<T> execute(
            String operation,
            RetryPolicy policy,
            RetryListener listener,
            Function<RetryContext, CallOutcome<T>> attempt
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first(ticker);
        CallOutcome<T> result = runAttempt(operation, attempt, context);

        while (result instanceof CallOutcome.Fail<T> fail) {
            ApiFailure failure = fail.failure().withAttempts(context.attemptNumber());
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.Retry retry) {
                reporter.reportRetryAttempt(failure, context.attemptNumber(), retry.delay());
                listener.beforeRetry(failure, context.attemptNumber(), policy.maxAttempts(), retry.delay());
                try {
                    sleeper.sleep(retry.delay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return giveUp(interrupted(operation, failure, e), false);
                }
                context = context.next(ticker);
                result = runAttempt(operation, attempt, context);
                continue;
            }

            RetryDecision.GiveUp stop = (RetryDecision.GiveUp) decision;
            log.debug("{}: {}", operation, stop.detail());
            return giveUp(failure, stop.exhausted());
        }

        return result;
    }

    private <T> CallOutcome<T> giveUp(ApiFailure failure, boolean exhausted) {
        ApiFailure terminal = failure.terminal();
        if (exhausted) {
            reporter.reportRetryExhausted(terminal, terminal.attempts());
        }
        reporter.report(terminal);
        return CallOutcome.fail(terminal);
    }

    private static <T> CallOutcome<T> runAttempt(
            String operation,
            Function<RetryContext, CallOutcome<T>> attempt,
            RetryContext context
    ) {
        CallOutcome<T> result = attempt.apply(context);
        if (result == null) {
            return CallOutcome.fail(ApiFailure.unexpected(operation,
                    "All retry attempts failed: attempt " + context.attemptNumber()
                            + " of " + operation + " produced no result", null)
                    .withAttempts(context.attemptNumber()));
        }
        return result;
    }

    private static ApiFailure interrupted(String operation, ApiFailure last, InterruptedException e) {
        String lastStatus = last.status() == null ? "" : " (last status " + last.status() + ")";
        return ApiFailure.unexpected(operation,
                        "Interrupted while waiting to retry " + operation + " after " + last.code() + lastStatus, e)
                .withAttempts(last.attempts());
    }
}
