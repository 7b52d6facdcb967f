package org.javai.gitpulse.api;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.Cause;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.http.ApiRequest;
import org.javai.gitpulse.http.ApiResponse;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies the result of one attempt into a {@link CallOutcome}.
 *
 * <p>Pure: the decision depends only on the response status, the quota header and the
 * exception type, never on the transport's exception hierarchy beyond that. The retry loop
 * branches on {@link ApiFailure#retriable()}.
 *
 * <ul>
 *   <li>2xx → success</li>
 *   <li>status in the retriable set (default 429, 500, 502, 503, 504) → retriable
 *       {@code RATE_LIMITED} for 429, {@code UPSTREAM_SERVER} otherwise</li>
 *   <li>401 → {@code AUTHENTICATION}, 404 → {@code NOT_FOUND}</li>
 *   <li>403 → {@code AUTHORIZATION}, or {@code RATE_LIMITED} when the quota header reads 0</li>
 *   <li>any other status → terminal {@code UNEXPECTED} with the status and a body excerpt</li>
 *   <li>{@link HttpTimeoutException} → retriable {@code TIMEOUT}; other IO errors → retriable {@code NETWORK}</li>
 * </ul>
 */
public class ApiFailureClassifier {

    public static final Set<Integer> DEFAULT_RETRIABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";

    private static final int BODY_EXCERPT = 200;

    private final Set<Integer> retriableStatuses;

    public ApiFailureClassifier() {
        this(DEFAULT_RETRIABLE_STATUSES);
    }

    public ApiFailureClassifier(Set<Integer> retriableStatuses) {
        this.retriableStatuses = Set.copyOf(Objects.requireNonNull(retriableStatuses, "retriableStatuses must not be null"));
    }

    public CallOutcome<ApiResponse> classify(ApiRequest request, ApiResponse response) {
        int status = response.status();
        if (response.isSuccessful()) {
            return CallOutcome.success(response, status);
        }

        String operation = request.describe();
        if (retriableStatuses.contains(status)) {
            ErrorKind kind = status == 429 ? ErrorKind.RATE_LIMITED : ErrorKind.UPSTREAM_SERVER;
            return CallOutcome.fail(ApiFailure.transientFailure(kind,
                    "HTTP " + status + " from " + operation, status, operation, null));
        }

        return CallOutcome.fail(switch (status) {
            case 401 -> terminal(ErrorKind.AUTHENTICATION, response, operation);
            case 403 -> response.intHeader(RATE_LIMIT_REMAINING).orElse(-1) == 0
                    ? terminal(ErrorKind.RATE_LIMITED, response, operation)
                    : terminal(ErrorKind.AUTHORIZATION, response, operation);
            case 404 -> terminal(ErrorKind.NOT_FOUND, response, operation);
            default -> ApiFailure.terminalFailure(ErrorKind.UNEXPECTED,
                    "HTTP " + status + " from " + operation + ": " + response.bodyExcerpt(BODY_EXCERPT),
                    status, operation, null);
        });
    }

    public ApiFailure classify(ApiRequest request, IOException e) {
        String operation = request.describe();
        Cause cause = Cause.fromThrowable(e);
        if (e instanceof HttpTimeoutException) {
            return ApiFailure.transientFailure(ErrorKind.TIMEOUT,
                    "Timed out calling " + operation + ": " + cause.describe(), null, operation, cause);
        }
        return ApiFailure.transientFailure(ErrorKind.NETWORK,
                "Network error calling " + operation + ": " + cause.describe(), null, operation, cause);
    }

    private static ApiFailure terminal(ErrorKind kind, ApiResponse response, String operation) {
        return ApiFailure.terminalFailure(kind, "HTTP " + response.status() + " from " + operation,
                response.status(), operation, null);
    }
}
