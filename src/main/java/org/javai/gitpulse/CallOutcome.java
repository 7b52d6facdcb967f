package org.javai.gitpulse;

import java.util.Objects;
import java.util.function.Function;

/**
 * The terminal result of a logical API call.
 * Either {@link Success} carrying the payload and the HTTP status it arrived with,
 * or {@link Fail} carrying a classified {@link ApiFailure}.
 *
 * <p>Every attempt made by the retry loop also produces a {@code CallOutcome}; the loop
 * branches on the tag and on {@link ApiFailure#retriable()}, never on caught exception types.
 *
 * @param <T> The type of the successful payload
 */
public sealed interface CallOutcome<T> permits CallOutcome.Success, CallOutcome.Fail {

    /**
     * A successful call.
     *
     * @param value the payload
     * @param status the HTTP status of the response that produced it, or 0 when derived locally
     */
    record Success<T>(T value, int status) implements CallOutcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> CallOutcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value), status);
        }

        @Override
        public <U> CallOutcome<U> flatMap(Function<? super T, ? extends CallOutcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public CallOutcome<T> recover(Function<? super ApiFailure, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed call.
     *
     * @param failure the classified failure
     */
    record Fail<T>(ApiFailure failure) implements CallOutcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new ApiCallException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> CallOutcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> CallOutcome<U> flatMap(Function<? super T, ? extends CallOutcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public CallOutcome<T> recover(Function<? super ApiFailure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Success<>(recovery.apply(failure), 0);
        }
    }

    boolean isSuccess();

    default boolean isFail() {
        return !isSuccess();
    }

    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> CallOutcome<U> map(Function<? super T, ? extends U> mapper);

    <U> CallOutcome<U> flatMap(Function<? super T, ? extends CallOutcome<U>> mapper);

    CallOutcome<T> recover(Function<? super ApiFailure, ? extends T> recovery);

    /**
     * Returns the failure of a {@link Fail}, or {@code null} for a {@link Success}.
     */
    default ApiFailure failureOrNull() {
        return this instanceof Fail<T> fail ? fail.failure() : null;
    }

    static <T> CallOutcome<T> success(T value) {
        return new Success<>(value, 0);
    }

    static <T> CallOutcome<T> success(T value, int status) {
        return new Success<>(value, status);
    }

    static <T> CallOutcome<T> fail(ApiFailure failure) {
        return new Fail<>(failure);
    }
}
