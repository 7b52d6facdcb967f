package org.javai.gitpulse;

/**
 * The closed set of failure kinds surfaced by the API access layer.
 *
 * <p>Each kind has a stable machine-readable {@link #code()} and a JSON-RPC style
 * {@link #rpcCode()}: {@code -32602} when the caller can fix the request, {@code -32603}
 * when the failure lies upstream or in the transport.
 */
public enum ErrorKind {

    /** Credential missing or rejected (HTTP 401). */
    AUTHENTICATION("authentication_error", -32602,
            "Authentication failed. Check the GitHub token."),

    /** Credential lacks access to the resource (HTTP 403). */
    AUTHORIZATION("authorization_error", -32602,
            "Access denied. Check the permissions of the GitHub token."),

    /** The target resource does not exist (HTTP 404). */
    NOT_FOUND("not_found", -32602,
            "Resource not found. Check the owner and repository name."),

    /** Upstream quota exhausted (HTTP 429 past the attempt budget, or 403 with no quota left). */
    RATE_LIMITED("rate_limited", -32603,
            "GitHub API rate limit exceeded. Try again later."),

    /** 5xx persisting past the attempt budget. */
    UPSTREAM_SERVER("upstream_server_error", -32603,
            "GitHub API server error."),

    /** Network timeout persisting past the attempt budget. */
    TIMEOUT("timeout", -32603,
            "GitHub API did not respond in time."),

    /** Connection-level failure persisting past the attempt budget. */
    NETWORK("network_error", -32603,
            "Network error while contacting GitHub API. Check connectivity."),

    /** Caller-supplied arguments failed a local precondition. Never retried, never sent upstream. */
    VALIDATION("validation_error", -32602,
            "Invalid parameters."),

    /** Anything else. The failure message always carries the original description. */
    UNEXPECTED("unexpected_error", -32603,
            "Unexpected error.");

    private final String code;
    private final int rpcCode;
    private final String summary;

    ErrorKind(String code, int rpcCode, String summary) {
        this.code = code;
        this.rpcCode = rpcCode;
        this.summary = summary;
    }

    public String code() {
        return code;
    }

    public int rpcCode() {
        return rpcCode;
    }

    /**
     * A short user-facing sentence describing this kind of failure.
     */
    public String summary() {
        return summary;
    }
}
