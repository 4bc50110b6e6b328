package com.recyclesystems;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a message processed by a service, carried back to the caller
 * through a {@link ReplySlot}. Sealed to the two variants.
 *
 * @param <T> the value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value (which may be null).
     */
    record Success<T>(T value) implements Result<T> {
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
    }

    /**
     * Failed result containing the error to raise at the call site.
     */
    record Failure<T>(ServiceException error) implements Result<T> {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("Failure requires an error");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw error;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }
    }

    boolean isSuccess();

    /**
     * Returns the value, or throws the carried {@link ServiceException}.
     */
    T getOrThrow();

    T getOrElse(T defaultValue);

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            return new Success<>(fn.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<ServiceException> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ServiceException error) {
        return new Failure<>(error);
    }
}
