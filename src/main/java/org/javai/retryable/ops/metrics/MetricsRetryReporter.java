package org.javai.retryable.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.retryable.Outcome;
import org.javai.retryable.ops.RetryReporter;
import org.javai.retryable.retry.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object with an {@code eventType} of {@code retry_attempt},
 * {@code retry_exhausted} or {@code retry_skipped}, and a {@code trackingKey} made of the
 * optional namespace and the policy id.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.aws","retryIndex":0,"delayMs":2000,"kind":"java.net.SocketTimeoutException","outcome":"thrown"}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retryable.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.objectMapper = new ObjectMapper();
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(Outcome<?> outcome, int retryIndex, Duration delay, String policyId) {
		emit(buildRetryAttemptEvent(outcome, retryIndex, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(Outcome<?> outcome, int totalAttempts, String policyId) {
		emit(buildRetryExhaustedEvent(outcome, totalAttempts, policyId));
	}

	@Override
	public void reportNotRetried(Outcome<?> outcome, RetryDecision.Reason reason, String policyId) {
		emit(buildNotRetriedEvent(outcome, reason, policyId));
	}

	ObjectNode buildRetryAttemptEvent(Outcome<?> outcome, int retryIndex, Duration delay, String policyId) {
		ObjectNode event = baseEvent("retry_attempt", outcome, policyId);
		event.put("retryIndex", retryIndex);
		event.put("delayMs", delay.toMillis());
		return event;
	}

	ObjectNode buildRetryExhaustedEvent(Outcome<?> outcome, int totalAttempts, String policyId) {
		ObjectNode event = baseEvent("retry_exhausted", outcome, policyId);
		event.put("totalAttempts", totalAttempts);
		return event;
	}

	ObjectNode buildNotRetriedEvent(Outcome<?> outcome, RetryDecision.Reason reason, String policyId) {
		ObjectNode event = baseEvent("retry_skipped", outcome, policyId);
		event.put("reason", reason.name());
		return event;
	}

	String buildTrackingKey(String policyId) {
		if (namespace == null) {
			return policyId;
		}
		return namespace + "." + policyId;
	}

	private ObjectNode baseEvent(String eventType, Outcome<?> outcome, String policyId) {
		ObjectNode event = objectMapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(policyId));
		event.put("kind", outcome.kind());
		event.put("outcome", outcome.isFail() ? "thrown" : "returned");
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(objectMapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.debug("Could not serialize retry event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
