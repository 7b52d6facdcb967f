package org.javai.gitpulse.tools;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.ErrorKind;

import java.util.Objects;

/**
 * Raised by an operation that could not produce a result. Carries the classified failure so a
 * transport layer can map it to its own error codes.
 */
public class ToolException extends RuntimeException {

    private final String operation;
    private final ApiFailure failure;

    public ToolException(String operation, ApiFailure failure) {
        super(message(operation, failure));
        this.operation = operation;
        this.failure = failure;
    }

    public String operation() {
        return operation;
    }

    public ApiFailure failure() {
        return failure;
    }

    public ErrorKind kind() {
        return failure.kind();
    }

    /**
     * The JSON-RPC error code for this failure: -32602 for caller mistakes, -32603 otherwise.
     */
    public int rpcCode() {
        return failure.kind().rpcCode();
    }

    private static String message(String operation, ApiFailure failure) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
        return "Error during " + operation + ": " + failure.userMessage();
    }
}
