package org.javai.retryable.retry;

import org.javai.retryable.Outcome;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A resolved, immutable retry configuration for one call.
 *
 * @param id The configuration name, used in reporting
 * @param maxTries Retries allowed after the first attempt
 * @param failureMatchers Exception kinds to retry; empty retries every kind
 * @param messageMatchers Exception messages to retry; empty retries every message
 * @param errorPredicate Which returned values are failures; empty never retries a returned value
 * @param sleepSpec Delay before each retry
 * @param finallyHook Run once when the call completes
 */
public record Policy(
        String id,
        int maxTries,
        List<FailureMatcher> failureMatchers,
        List<MessageMatcher> messageMatchers,
        Optional<Predicate<Object>> errorPredicate,
        SleepSpec sleepSpec,
        Runnable finallyHook
) {

    public Policy {
        Objects.requireNonNull(id, "id must not be null");
        if (maxTries < 0) {
            throw new IllegalArgumentException("maxTries must be >= 0, was: " + maxTries);
        }
        failureMatchers = List.copyOf(failureMatchers);
        messageMatchers = List.copyOf(messageMatchers);
        Objects.requireNonNull(errorPredicate, "errorPredicate must not be null, use Optional.empty()");
        Objects.requireNonNull(sleepSpec, "sleepSpec must not be null");
        Objects.requireNonNull(finallyHook, "finallyHook must not be null");
    }

    /**
     * Evaluates an attempt's outcome and decides what happens next.
     *
     * <p>A thrown failure is checked for exhaustion first, then for its kind, then for its
     * message. A returned value is only ever retried when the error predicate accepts it.
     *
     * @param context The current retry context
     * @param outcome The outcome of the attempt that just completed
     * @return Accept, Retry with a delay, or GiveUp
     */
    public RetryDecision decide(RetryContext context, Outcome<?> outcome) {
        if (outcome instanceof Outcome.Ok<?> ok) {
            if (errorPredicate.isEmpty() || !errorPredicate.get().test(ok.value())) {
                return RetryDecision.Accept.INSTANCE;
            }
            if (isExhausted(context)) {
                return RetryDecision.GiveUp.because(RetryDecision.Reason.EXHAUSTED);
            }
            return RetryDecision.Retry.after(sleepSpec.delayFor(context.retryIndex()));
        }

        Outcome.Fail<?> fail = (Outcome.Fail<?>) outcome;
        if (isExhausted(context)) {
            return RetryDecision.GiveUp.because(RetryDecision.Reason.EXHAUSTED);
        }
        if (!kindMatches(fail.failure())) {
            return RetryDecision.GiveUp.because(RetryDecision.Reason.KIND_NOT_MATCHED);
        }
        if (!messageMatches(fail.message())) {
            return RetryDecision.GiveUp.because(RetryDecision.Reason.MESSAGE_NOT_MATCHED);
        }
        return RetryDecision.Retry.after(sleepSpec.delayFor(context.retryIndex()));
    }

    private boolean isExhausted(RetryContext context) {
        return context.retryIndex() == maxTries;
    }

    private boolean kindMatches(Exception failure) {
        if (failureMatchers.isEmpty()) {
            return true;
        }
        return failureMatchers.stream().anyMatch(matcher -> matcher.matches(failure));
    }

    private boolean messageMatches(String message) {
        if (messageMatchers.isEmpty()) {
            return true;
        }
        return messageMatchers.stream().anyMatch(matcher -> matcher.matches(message));
    }
}
