package org.javai.retryable.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a policy after evaluating an attempt's outcome.
 */
public sealed interface RetryDecision permits RetryDecision.Accept, RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * The outcome is a success; return the value.
     */
    record Accept() implements RetryDecision {
        static final Accept INSTANCE = new Accept();
    }

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Do not retry; the outcome goes back to the caller as it is.
     */
    record GiveUp(Reason reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(Reason reason) {
            return new GiveUp(reason);
        }
    }

    enum Reason {
        /** No retries remain. */
        EXHAUSTED,
        /** The exception kind is not one the policy retries. */
        KIND_NOT_MATCHED,
        /** The exception message matches none of the policy's message matchers. */
        MESSAGE_NOT_MATCHED
    }
}
