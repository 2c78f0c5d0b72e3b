package org.javai.retryable.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retryable.Outcome;
import org.javai.retryable.retry.RetryDecision;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.builder()
 *     .add(new Log4jRetryReporter())
 *     .addIf(metricsEnabled, new MetricsRetryReporter("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(Outcome<?> outcome, int retryIndex, Duration delay, String policyId) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(outcome, retryIndex, delay, policyId);
			} catch (Exception e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryExhausted(Outcome<?> outcome, int totalAttempts, String policyId) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryExhausted(outcome, totalAttempts, policyId);
			} catch (Exception e) {
				logReporterError("reportRetryExhausted", reporter, e);
			}
		}
	}

	@Override
	public void reportNotRetried(Outcome<?> outcome, RetryDecision.Reason reason, String policyId) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportNotRetried(outcome, reason, policyId);
			} catch (Exception e) {
				logReporterError("reportNotRetried", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, RetryReporter reporter, Exception e) {
		LOGGER.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite; null is ignored.
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when {@code condition} holds.
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}
