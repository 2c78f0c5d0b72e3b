package org.javai.retryable.retry;

import java.util.Objects;

/**
 * Decides whether a thrown exception is of a kind the policy retries.
 */
@FunctionalInterface
public interface FailureMatcher {

    boolean matches(Exception failure);

    /**
     * Matches exceptions whose class is exactly {@code kind}; subclasses do not match.
     * This is how a bare class in the {@code on} option is interpreted.
     */
    static FailureMatcher kind(Class<? extends Exception> kind) {
        return new Kind(kind);
    }

    /**
     * Matches exceptions that are instances of {@code kind}, subclasses included.
     */
    static FailureMatcher kindOrSubtype(Class<? extends Exception> kind) {
        return new KindOrSubtype(kind);
    }

    record Kind(Class<? extends Exception> kind) implements FailureMatcher {
        public Kind {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public boolean matches(Exception failure) {
            return failure.getClass() == kind;
        }
    }

    record KindOrSubtype(Class<? extends Exception> kind) implements FailureMatcher {
        public KindOrSubtype {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public boolean matches(Exception failure) {
            return kind.isInstance(failure);
        }
    }
}
