package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Success-or-{@link StackError} union returned by queries.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure
{
    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(StackError error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(StackError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> toOptional() {
        if (this instanceof Success<T> s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }

    default Optional<StackError> errorOptional() {
        if (this instanceof Failure<T> f) {
            return Optional.of(f.error());
        }
        return Optional.empty();
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> s) {
            return success(mapper.apply(s.value()));
        }
        return failure(((Failure<T>) this).error());
    }
}
