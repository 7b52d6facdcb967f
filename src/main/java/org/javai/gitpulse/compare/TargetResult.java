package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiFailure;

import java.util.Objects;

/**
 * The outcome for one target of a comparison. Failed targets stay in the result
 * with their failure instead of being dropped.
 */
public sealed interface TargetResult permits TargetResult.Succeeded, TargetResult.Failed {

    ComparisonTarget target();

    boolean isSuccess();

    record Succeeded(ComparisonTarget target, RepositoryMetrics metrics) implements TargetResult {

        public Succeeded {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(metrics, "metrics must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failed(ComparisonTarget target, ApiFailure failure) implements TargetResult {

        public Failed {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
