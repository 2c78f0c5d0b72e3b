package org.javai.retryable;

import java.util.Objects;

/**
 * The outcome of a single attempt.
 * Either {@link Ok} holding the value the work returned, or {@link Fail} holding the
 * exception it threw.
 *
 * <p>An {@code Ok} is not necessarily a success: a policy with an error predicate may
 * still treat the returned value as a retryable failure.
 *
 * @param <T> The type of the returned value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * The work returned normally.
     *
     * @param value the returned value (may be null)
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
        public String kind() {
            return value == null ? "null" : value.getClass().getName();
        }

        @Override
        public String message() {
            return String.valueOf(value);
        }
    }

    /**
     * The work threw an exception.
     *
     * @param failure the exception, never null
     */
    record Fail<T>(Exception failure) implements Outcome<T> {

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
        public String kind() {
            return failure.getClass().getName();
        }

        /**
         * The exception message, or an empty string when the exception has none.
         */
        @Override
        public String message() {
            return failure.getMessage() == null ? "" : failure.getMessage();
        }
    }

    boolean isOk();
    boolean isFail();

    /**
     * The exception class name for a failure, or the value's class name for a returned value.
     */
    String kind();

    String message();

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Exception failure) {
        return new Fail<>(failure);
    }

    /**
     * Runs the work once and captures what happened.
     * Exceptions become {@link Fail}; {@link Error}s are not caught.
     *
     * @param work the work to run
     * @return Ok with the returned value, or Fail with the thrown exception
     */
    static <T> Outcome<T> of(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return ok(work.get());
        } catch (Exception e) {
            return fail(e);
        }
    }
}
