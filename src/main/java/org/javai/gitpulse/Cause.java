package org.javai.gitpulse;

import java.util.Objects;

/**
 * Captures the underlying exception of a failure for diagnostics.
 *
 * @param type The exception class name
 * @param fingerprint A stable identifier for deduplication (exception type and top stack frame)
 * @param detail The exception message (may be null)
 */
public record Cause(String type, String fingerprint, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Cause fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        return new Cause(t.getClass().getName(), computeFingerprint(t), t.getMessage());
    }

    /**
     * Returns the detail if present, otherwise the exception type.
     */
    public String describe() {
        return detail != null && !detail.isBlank() ? detail : type;
    }

    private static String computeFingerprint(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
