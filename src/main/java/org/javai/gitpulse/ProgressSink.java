package org.javai.gitpulse;

import java.util.Objects;

/**
 * Receives progress notifications from a running operation: retry notices, quota warnings,
 * stage messages and errors. Notifications are advisory and never change the result of the
 * operation that emits them.
 */
public interface ProgressSink {

    void info(String message);

    void error(String message);

    /**
     * Reports how far an operation has come, as {@code done} out of {@code total}.
     */
    default void progress(int done, int total) {
    }

    static ProgressSink noOp() {
        return new ProgressSink() {
            @Override
            public void info(String message) {
            }

            @Override
            public void error(String message) {
            }
        };
    }

    /**
     * Wraps a caller-supplied sink so that a failing sink cannot disturb the operation.
     */
    static ProgressSink guarded(ProgressSink delegate) {
        Objects.requireNonNull(delegate, "delegate must not be null");
        return delegate instanceof GuardedProgressSink ? delegate : new GuardedProgressSink(delegate);
    }
}
