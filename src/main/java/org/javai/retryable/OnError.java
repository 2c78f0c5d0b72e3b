package org.javai.retryable;

import org.javai.retryable.retry.ErrorValues;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * An {@code on} entry that makes returned values retryable.
 *
 * <p>{@link #ERROR} uses {@link ErrorValues#isError(Object)} to recognize error values.
 * {@link #when(Predicate)} supplies a predicate of the caller's own; an explicit predicate
 * takes precedence over {@code ERROR} when both appear in the same options.
 *
 * @param predicate decides whether a returned value is a failure
 * @param explicit whether the predicate was supplied by the caller
 */
public record OnError(Predicate<Object> predicate, boolean explicit) {

    /**
     * Retry when the work returns a recognized error value.
     */
    public static final OnError ERROR = new OnError(ErrorValues::isError, false);

    public OnError {
        Objects.requireNonNull(predicate, "predicate must not be null");
    }

    /**
     * Retry when the work returns a value matching the predicate.
     *
     * @param predicate decides whether a returned value is a failure
     * @return an explicit error entry
     */
    public static OnError when(Predicate<Object> predicate) {
        return new OnError(predicate, true);
    }
}
