package com.nayem.tessera.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a component boundary call: either a value or an
 * {@link EngineError}. Used instead of exceptions for every failure a client
 * can cause.
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(EngineError error) {
        return new Err<>(error);
    }

    boolean isOk();

    /**
     * @return the success value
     * @throws IllegalStateException if this is an error
     */
    T value();

    /**
     * @return the error
     * @throws IllegalStateException if this is a success
     */
    EngineError error();

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isOk()) {
            return ok(mapper.apply(value()));
        }
        return err(error());
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (isOk()) {
            return mapper.apply(value());
        }
        return err(error());
    }

    record Ok<T>(T value) implements Result<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public EngineError error() {
            throw new IllegalStateException("Result is a success");
        }
    }

    record Err<T>(EngineError error) implements Result<T> {

        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is an error: " + error);
        }
    }
}
