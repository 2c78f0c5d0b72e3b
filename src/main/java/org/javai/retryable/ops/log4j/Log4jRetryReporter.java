package org.javai.retryable.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retryable.Outcome;
import org.javai.retryable.ops.RetryReporter;
import org.javai.retryable.retry.RetryDecision;

import java.time.Duration;

/**
 * Reports retry events using Log4j2.
 *
 * <ul>
 *   <li>retry attempt → INFO, marker {@code RETRY}</li>
 *   <li>retries exhausted → WARN, marker {@code RETRY_EXHAUSTED}</li>
 *   <li>failure not retried → DEBUG, marker {@code RETRY_SKIPPED}</li>
 * </ul>
 *
 * <p>Thrown failures are attached to the exhausted event so their stack trace is logged once.
 */
public class Log4jRetryReporter implements RetryReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker RETRY_SKIPPED_MARKER = MarkerManager.getMarker("RETRY_SKIPPED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retryable.RetryReporter"));
	}

	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(Outcome<?> outcome, int retryIndex, Duration delay, String policyId) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} with policy [{}] in {} ms. Kind: {}, Message: {}",
				retryIndex + 1,
				policyId,
				delay.toMillis(),
				outcome.kind(),
				outcome.message());
	}

	@Override
	public void reportRetryExhausted(Outcome<?> outcome, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.withThrowable(outcome instanceof Outcome.Fail<?> fail ? fail.failure() : null)
			.log("Retry exhausted after {} attempts with policy [{}]. Kind: {}, Message: {}",
				totalAttempts,
				policyId,
				outcome.kind(),
				outcome.message());
	}

	@Override
	public void reportNotRetried(Outcome<?> outcome, RetryDecision.Reason reason, String policyId) {
		logger.atDebug()
			.withMarker(RETRY_SKIPPED_MARKER)
			.log("Not retrying with policy [{}]: {}. Kind: {}, Message: {}",
				policyId,
				describe(reason),
				outcome.kind(),
				outcome.message());
	}

	private static String describe(RetryDecision.Reason reason) {
		return switch (reason) {
			case EXHAUSTED -> "no retries remain";
			case KIND_NOT_MATCHED -> "exception kind not retried";
			case MESSAGE_NOT_MATCHED -> "exception message not retried";
		};
	}
}
