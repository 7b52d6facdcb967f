package org.javai.gitpulse;

import java.time.Instant;
import java.util.Objects;

/**
 * A classified failure of one attempt or of a whole logical call.
 *
 * @param kind The taxonomy entry
 * @param message Human-readable description, always including the original cause's description
 * @param retriable Whether another attempt might succeed
 * @param status The last observed HTTP status, or null when no response was received
 * @param operation The request that failed (e.g., "GET /repos/octocat/hello-world")
 * @param attempts How many attempts were made before this failure became final (0 when never sent)
 * @param cause The underlying exception, or null for status-based failures
 * @param occurredAt When the failure was classified
 */
public record ApiFailure(
        ErrorKind kind,
        String message,
        boolean retriable,
        Integer status,
        String operation,
        int attempts,
        Cause cause,
        Instant occurredAt
) {

    public ApiFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    /**
     * A failure that may resolve on another attempt.
     */
    public static ApiFailure transientFailure(ErrorKind kind, String message, Integer status,
                                              String operation, Cause cause) {
        return new ApiFailure(kind, message, true, status, operation, 1, cause, Instant.now());
    }

    /**
     * A failure that ends the logical call immediately.
     */
    public static ApiFailure terminalFailure(ErrorKind kind, String message, Integer status,
                                             String operation, Cause cause) {
        return new ApiFailure(kind, message, false, status, operation, 1, cause, Instant.now());
    }

    /**
     * A caller mistake detected before anything was sent upstream.
     */
    public static ApiFailure validation(String operation, String message) {
        return new ApiFailure(ErrorKind.VALIDATION, message, false, null, operation, 0, null, Instant.now());
    }

    /**
     * No credential is configured; detected before anything was sent upstream.
     */
    public static ApiFailure missingCredential(String operation) {
        return new ApiFailure(ErrorKind.AUTHENTICATION, "No GitHub token is configured (set GITHUB_TOKEN)",
                false, null, operation, 0, null, Instant.now());
    }

    /**
     * The catch-all. The message must carry the original description.
     */
    public static ApiFailure unexpected(String operation, String message, Throwable t) {
        return new ApiFailure(ErrorKind.UNEXPECTED, message, false, null, operation, 0,
                t == null ? null : Cause.fromThrowable(t), Instant.now());
    }

    public ApiFailure withAttempts(int attempts) {
        return new ApiFailure(kind, message, retriable, status, operation, attempts, cause, occurredAt);
    }

    /**
     * Returns a copy that no retry policy will retry.
     */
    public ApiFailure terminal() {
        return retriable
                ? new ApiFailure(kind, message, false, status, operation, attempts, cause, occurredAt)
                : this;
    }

    /**
     * The stable machine-readable code of this failure's kind.
     */
    public String code() {
        return kind.code();
    }

    /**
     * A caller-facing message: the kind's summary followed by the detail.
     */
    public String userMessage() {
        return kind.summary() + " " + message;
    }
}
