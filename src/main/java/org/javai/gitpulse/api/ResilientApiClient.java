package org.javai.gitpulse.api;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.clock.Sleeper;
import org.javai.gitpulse.clock.Ticker;
import org.javai.gitpulse.http.ApiRequest;
import org.javai.gitpulse.http.ApiResponse;
import org.javai.gitpulse.http.HttpTransport;
import org.javai.gitpulse.ops.OpReporter;
import org.javai.gitpulse.ratelimit.RateBudget;
import org.javai.gitpulse.retry.Retrier;
import org.javai.gitpulse.retry.RetryContext;
import org.javai.gitpulse.retry.RetryListener;
import org.javai.gitpulse.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The single path by which anything reaches the upstream API.
 *
 * <p>Every attempt first takes a permit from the shared {@link RateBudget}, so retries count
 * against the same budget as first attempts. Transient failures are retried with exponential
 * backoff; the returned outcome is always terminal. Checked transport exceptions never leave
 * this class; they are classified into failures like any error status.
 *
 * <pre>{@code
 * ResilientApiClient client = ResilientApiClient.builder(transport)
 *     .rateBudget(budget)
 *     .reporter(reporter)
 *     .build();
 * CallOutcome<ApiResponse> repo = client.execute(ApiRequest.get("/repos/octocat/hello-world"), sink);
 * }</pre>
 */
public final class ResilientApiClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientApiClient.class);

    static final String POLICY_ID = "github-api";

    private final HttpTransport transport;
    private final RateBudget rateBudget;
    private final ApiFailureClassifier classifier;
    private final OpReporter reporter;
    private final Retrier retrier;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int quotaLowWaterMark;

    private ResilientApiClient(Builder builder) {
        this.transport = builder.transport;
        this.rateBudget = builder.rateBudget;
        this.classifier = new ApiFailureClassifier(builder.retriableStatuses);
        this.reporter = builder.reporter;
        this.retrier = new Retrier(builder.reporter, builder.sleeper, builder.ticker);
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.quotaLowWaterMark = builder.quotaLowWaterMark;
    }

    public static Builder builder(HttpTransport transport) {
        return new Builder(transport);
    }

    /**
     * Executes a request with the configured attempt budget.
     */
    public CallOutcome<ApiResponse> execute(ApiRequest request, ProgressSink sink) {
        return execute(request, sink, maxAttempts);
    }

    /**
     * Executes a request with an explicit attempt budget.
     *
     * @param request What to send
     * @param sink Receives retry notices and quota warnings
     * @param attempts Maximum number of attempts, at least 1
     * @return A terminal outcome: the first successful response, or the last failure
     */
    public CallOutcome<ApiResponse> execute(ApiRequest request, ProgressSink sink, int attempts) {
        Objects.requireNonNull(request, "request must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        ProgressSink progress = ProgressSink.guarded(Objects.requireNonNull(sink, "sink must not be null"));
        String operation = request.describe();
        RetryPolicy policy = RetryPolicy.exponentialBackoff(POLICY_ID, attempts, baseDelay, maxDelay);

        return retrier.execute(operation, policy, retryNotices(progress),
                context -> attempt(request, progress, context));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private CallOutcome<ApiResponse> attempt(ApiRequest request, ProgressSink progress, RetryContext context) {
        String operation = request.describe();
        try {
            rateBudget.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.fail(ApiFailure.unexpected(operation,
                    "Interrupted while waiting for a rate permit for " + operation, e));
        }

        ApiResponse response;
        try {
            log.debug("{} attempt {}", operation, context.attemptNumber());
            response = transport.send(request);
        } catch (IOException e) {
            return CallOutcome.fail(classifier.classify(request, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.fail(ApiFailure.unexpected(operation,
                    "Interrupted while calling " + operation, e));
        }

        checkQuota(operation, response, progress);
        return classifier.classify(request, response);
    }

    private void checkQuota(String operation, ApiResponse response, ProgressSink progress) {
        response.intHeader(ApiFailureClassifier.RATE_LIMIT_REMAINING).ifPresent(remaining -> {
            if (remaining < quotaLowWaterMark) {
                progress.info("GitHub API rate limit low: " + remaining + " requests remaining");
                reporter.reportQuotaLow(operation, remaining);
            }
        });
    }

    private static RetryListener retryNotices(ProgressSink progress) {
        return (failure, attemptNumber, maxAttempts, delay) -> progress.info(String.format(Locale.ROOT,
                "%s failed with %s, retrying in %.1fs (attempt %d/%d)",
                failure.operation(), describeStatus(failure), delay.toMillis() / 1000.0,
                attemptNumber + 1, maxAttempts));
    }

    private static String describeStatus(ApiFailure failure) {
        return failure.status() == null ? failure.code() : "HTTP " + failure.status();
    }

    public static final class Builder {

        private final HttpTransport transport;
        private RateBudget rateBudget = RateBudget.unlimited();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Sleeper.system();
        private Ticker ticker = Ticker.system();
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private Set<Integer> retriableStatuses = ApiFailureClassifier.DEFAULT_RETRIABLE_STATUSES;
        private int quotaLowWaterMark = 100;

        private Builder(HttpTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
        }

        public Builder rateBudget(RateBudget rateBudget) {
            this.rateBudget = Objects.requireNonNull(rateBudget, "rateBudget must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            return this;
        }

        public Builder retriableStatuses(Set<Integer> retriableStatuses) {
            this.retriableStatuses = Objects.requireNonNull(retriableStatuses, "retriableStatuses must not be null");
            return this;
        }

        public Builder quotaLowWaterMark(int quotaLowWaterMark) {
            this.quotaLowWaterMark = quotaLowWaterMark;
            return this;
        }

        public ResilientApiClient build() {
            return new ResilientApiClient(this);
        }
    }
}
