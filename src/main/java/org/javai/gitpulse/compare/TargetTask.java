package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiFailure;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks one target through its {@link TargetState} lifecycle and holds its result once
 * the state is terminal. Transitions are checked; a terminal state is never left.
 */
final class TargetTask {

    private final ComparisonTarget target;
    private final AtomicReference<TargetState> state = new AtomicReference<>(TargetState.PENDING);
    private volatile TargetResult result;

    TargetTask(ComparisonTarget target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    ComparisonTarget target() {
        return target;
    }

    TargetState state() {
        return state.get();
    }

    void start() {
        moveTo(TargetState.RUNNING);
    }

    TargetResult succeed(RepositoryMetrics metrics) {
        TargetResult succeeded = new TargetResult.Succeeded(target, metrics);
        moveTo(TargetState.SUCCEEDED);
        result = succeeded;
        return succeeded;
    }

    TargetResult fail(ApiFailure failure) {
        TargetResult failed = new TargetResult.Failed(target, failure);
        moveTo(TargetState.FAILED);
        result = failed;
        return failed;
    }

    /**
     * @throws IllegalStateException if the task has not reached a terminal state
     */
    TargetResult result() {
        TargetResult current = result;
        if (current == null) {
            throw new IllegalStateException(target.key() + " has no result in state " + state.get());
        }
        return current;
    }

    private void moveTo(TargetState next) {
        TargetState current = state.get();
        if (!current.canMoveTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException(
                    "Illegal transition for " + target.key() + ": " + current + " -> " + next);
        }
    }
}
