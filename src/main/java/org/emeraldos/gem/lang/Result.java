package org.emeraldos.gem.lang;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation which either produced a value or failed with a {@link Cause}.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(cause);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    @SuppressWarnings("unchecked")
    default <R> Result<R> flatMap(Function<? super T, Result<? extends R>> mapper) {
        return fold(Result::failure, value -> (Result<R>) mapper.apply(value));
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    /**
     * The failure cause, if any.
     */
    default Optional<Cause> causeOpt() {
        return fold(Optional::of, value -> Optional.empty());
    }

    /**
     * Extract the value of a successful result.
     *
     * @throws IllegalStateException if this result is a failure
     */
    default T unwrap() {
        return fold(cause -> {
                        throw new IllegalStateException("Unwrapping failed result: " + cause.message());
                    },
                    Function.identity());
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
