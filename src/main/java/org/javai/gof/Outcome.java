package org.javai.gof;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The result of constructing or running a pattern demo.
 * Either {@link Ok} containing a value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Outcomes are produced by {@link org.javai.gof.boundary.DemoBoundary}, the single place
 * where exceptions thrown by demo code are translated into values. Past the boundary the
 * catalog and the menu only ever look at outcomes.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null for {@code Outcome<Void>})
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
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
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public Outcome<T> onFailure(Consumer<? super Failure> action) {
            return this;
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> onFailure(Consumer<? super Failure> action) {
            Objects.requireNonNull(action);
            action.accept(failure);
            return this;
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    /**
     * Runs {@code action} with the failure when this outcome is a {@link Fail}.
     *
     * @return this outcome, for chaining
     */
    Outcome<T> onFailure(Consumer<? super Failure> action);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
