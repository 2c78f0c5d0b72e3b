package org.javai.retryable.ops;

import org.javai.retryable.Outcome;
import org.javai.retryable.retry.RetryDecision;

import java.time.Duration;

/**
 * Observes a retry sequence for logging, metrics or alerting.
 * Every method defaults to a no-op; implementations override what they need.
 */
public interface RetryReporter {

	/**
	 * Reports that an attempt failed and will be retried.
	 *
	 * @param outcome The failed outcome (a thrown exception or an error value)
	 * @param retryIndex Zero-based index of the retry about to happen
	 * @param delay How long the engine will sleep first
	 * @param policyId The policy being applied
	 */
	default void reportRetryAttempt(Outcome<?> outcome, int retryIndex, Duration delay, String policyId) {
		// Default: no-op.
	}

	/**
	 * Reports that retries ran out; the outcome is handed back to the caller.
	 *
	 * @param outcome The final outcome
	 * @param totalAttempts The number of attempts made
	 * @param policyId The policy that was exhausted
	 */
	default void reportRetryExhausted(Outcome<?> outcome, int totalAttempts, String policyId) {
		// Default: no-op.
	}

	/**
	 * Reports that a thrown failure did not match the policy and is propagated without retry.
	 *
	 * @param outcome The failed outcome
	 * @param reason Why the failure was not retried
	 * @param policyId The policy being applied
	 */
	default void reportNotRetried(Outcome<?> outcome, RetryDecision.Reason reason, String policyId) {
		// Default: no-op.
	}

	/**
	 * A reporter that does nothing.
	 */
	static RetryReporter noOp() {
		return NoOp.INSTANCE;
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static RetryReporter composite(RetryReporter... reporters) {
		return CompositeRetryReporter.of(reporters);
	}

	final class NoOp implements RetryReporter {
		private static final NoOp INSTANCE = new NoOp();

		private NoOp() {}
	}
}
