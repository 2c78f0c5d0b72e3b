package org.javai.retryable.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retryable.Outcome;
import org.javai.retryable.ThrowingSupplier;
import org.javai.retryable.ops.RetryReporter;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a unit of work under a {@link Policy}, re-invoking it until it succeeds, retries run
 * out, or it fails in a way the policy does not retry.
 *
 * <p>A failure that is not retried reaches the caller as the very exception the work threw.
 * An error value that exhausts the retries is returned, not thrown. The policy's finally hook
 * runs once per call, after the last attempt.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryEngine engine = new RetryEngine(Thread::sleep, new Log4jRetryReporter());
 * Response response = engine.execute(policy, () -> client.send(request));
 * }</pre>
 */
public final class RetryEngine {

    private static final Logger LOGGER = LogManager.getLogger(RetryEngine.class);

    private final Sleeper sleeper;
    private final RetryReporter reporter;

    public RetryEngine(Sleeper sleeper, RetryReporter reporter) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes the work with retry according to the policy.
     *
     * @param policy the resolved policy for this call
     * @param work the work to invoke once per attempt
     * @return the value of the last attempt
     * @throws E the exception of the last attempt, unchanged
     * @throws RetryInterruptedException if interrupted while sleeping between attempts
     */
    public <T, E extends Exception> T execute(Policy policy, ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            RetryContext context = RetryContext.first();
            Outcome<T> outcome = Outcome.of(work);
            RetryDecision decision = policy.decide(context, outcome);

            while (decision instanceof RetryDecision.Retry retry) {
                notifyRetryAttempt(outcome, context, retry.delay(), policy.id());
                sleep(retry.delay(), policy.id(), context, outcome);
                context = context.next();
                outcome = Outcome.of(work);
                decision = policy.decide(context, outcome);
            }

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                notifyGiveUp(outcome, context, giveUp.reason(), policy.id());
            }
            return this.<T, E>unwrap(outcome);
        } finally {
            policy.finallyHook().run();
        }
    }

    private <T, E extends Exception> T unwrap(Outcome<T> outcome) throws E {
        if (outcome instanceof Outcome.Fail<T> fail) {
            throw RetryEngine.<E>asDeclared(fail.failure());
        }
        return ((Outcome.Ok<T>) outcome).value();
    }

    // Erased cast: the exception keeps its identity.
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E asDeclared(Exception failure) {
        return (E) failure;
    }

    private void sleep(Duration delay, String policyId, RetryContext context, Outcome<?> lastOutcome) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RetryInterruptedException interrupted = new RetryInterruptedException(policyId, context.attemptCount(), e);
            if (lastOutcome instanceof Outcome.Fail<?> fail) {
                interrupted.addSuppressed(fail.failure());
            }
            throw interrupted;
        }
    }

    private void notifyRetryAttempt(Outcome<?> outcome, RetryContext context, Duration delay, String policyId) {
        try {
            reporter.reportRetryAttempt(outcome, context.retryIndex(), delay, policyId);
        } catch (RuntimeException e) {
            LOGGER.debug("Reporter failed on retry attempt for policy [{}]", policyId, e);
        }
    }

    private void notifyGiveUp(Outcome<?> outcome, RetryContext context, RetryDecision.Reason reason, String policyId) {
        try {
            if (reason == RetryDecision.Reason.EXHAUSTED) {
                reporter.reportRetryExhausted(outcome, context.attemptCount(), policyId);
            } else {
                reporter.reportNotRetried(outcome, reason, policyId);
            }
        } catch (RuntimeException e) {
            LOGGER.debug("Reporter failed on give-up for policy [{}]", policyId, e);
        }
    }
}
