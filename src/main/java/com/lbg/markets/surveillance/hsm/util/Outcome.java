package com.lbg.markets.surveillance.hsm.util;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Result of a computation that may have failed: either a {@link Success}
 * holding a value or a {@link Failure} holding the exception.
 * Used to hand results across the worker pool without throwing on a pool thread.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    /**
     * Run the task and capture either its value or the exception it threw.
     */
    static <T> Outcome<T> attempt(Callable<T> task) {
        try {
            return new Success<>(task.call());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(Exception error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Transform the value of a success. A failure is returned unchanged,
     * and an exception thrown by {@code fn} becomes a failure.
     */
    <U> Outcome<U> map(Function<? super T, ? extends U> fn);

    /**
     * Turn a failure into a success using {@code fn}. A success is returned unchanged.
     */
    Outcome<T> recover(Function<? super Exception, ? extends T> fn);

    /**
     * The value, or the captured exception rethrown.
     */
    T getOrThrow() throws Exception;

    Optional<Exception> error();

    /**
     * The value of a success, empty for a failure or a null value.
     */
    Optional<T> result();

    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Exception, ? extends R> onFailure);

    record Success<T>(T value) implements Outcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
            return attempt(() -> fn.apply(value));
        }

        @Override
        public Outcome<T> recover(Function<? super Exception, ? extends T> fn) {
            return this;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public Optional<Exception> error() {
            return Optional.empty();
        }

        @Override
        public Optional<T> result() {
            return Optional.ofNullable(value);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess,
                          Function<? super Exception, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Exception cause) implements Outcome<T> {

        public Failure {
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
            return new Failure<>(cause);
        }

        @Override
        public Outcome<T> recover(Function<? super Exception, ? extends T> fn) {
            return attempt(() -> fn.apply(cause));
        }

        @Override
        public T getOrThrow() throws Exception {
            throw cause;
        }

        @Override
        public Optional<Exception> error() {
            return Optional.of(cause);
        }

        @Override
        public Optional<T> result() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess,
                          Function<? super Exception, ? extends R> onFailure) {
            return onFailure.apply(cause);
        }
    }
}
