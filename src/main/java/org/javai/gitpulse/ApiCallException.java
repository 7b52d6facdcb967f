package org.javai.gitpulse;

import java.util.Objects;

/**
 * Thrown when a failed {@link CallOutcome} is unwrapped, and for validation errors raised
 * before a call is attempted. Unchecked: callers that want to branch should inspect the
 * outcome instead.
 */
public class ApiCallException extends RuntimeException {

    private final ApiFailure failure;

    public ApiCallException(ApiFailure failure) {
        super(Objects.requireNonNull(failure, "failure must not be null").message());
        this.failure = failure;
    }

    public ApiFailure failure() {
        return failure;
    }

    public ErrorKind kind() {
        return failure.kind();
    }

    public String code() {
        return failure.code();
    }

    /**
     * Raises a {@link ErrorKind#VALIDATION} failure for the given operation.
     */
    public static ApiCallException validation(String operation, String message) {
        return new ApiCallException(ApiFailure.validation(operation, message));
    }
}
