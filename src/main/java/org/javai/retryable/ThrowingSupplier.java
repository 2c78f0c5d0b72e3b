package org.javai.retryable;

/**
 * A unit of work that may throw a checked exception.
 * This is what {@link Retryable} invokes once per attempt.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
