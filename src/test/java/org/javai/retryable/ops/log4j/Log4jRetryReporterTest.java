package org.javai.retryable.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.retryable.Outcome;
import org.javai.retryable.retry.RetryDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jRetryReporterTest {

	private static final String LOGGER_NAME = "org.javai.retryable.test.Log4jRetryReporter";

	private Logger logger;
	private CapturingAppender appender;
	private Log4jRetryReporter reporter;

	@BeforeEach
	void setUp() {
		logger = (Logger) LogManager.getLogger(LOGGER_NAME);
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		reporter = new Log4jRetryReporter(logger);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void reportRetryAttempt_logsInfoWithRetryMarker() {
		reporter.reportRetryAttempt(Outcome.fail(new IOException("read timeout")), 0, Duration.ofMillis(250), "aws");

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("Retry 1 with policy [aws] in 250 ms. Kind: java.io.IOException, Message: read timeout");
	}

	@Test
	void reportRetryExhausted_logsWarnWithThrowable() {
		IOException failure = new IOException("read timeout");

		reporter.reportRetryExhausted(Outcome.fail(failure), 3, "aws");

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY_EXHAUSTED");
		assertThat(event.getThrown()).isSameAs(failure);
		assertThat(event.getMessage().getFormattedMessage()).startsWith("Retry exhausted after 3 attempts");
	}

	@Test
	void reportRetryExhausted_errorValue_hasNoThrowable() {
		reporter.reportRetryExhausted(Outcome.ok("error"), 2, "options");

		LogEvent event = appender.events.get(0);
		assertThat(event.getThrown()).isNull();
		assertThat(event.getMessage().getFormattedMessage()).endsWith("Kind: java.lang.String, Message: error");
	}

	@Test
	void reportNotRetried_logsDebugWithReason() {
		reporter.reportNotRetried(Outcome.fail(new IllegalStateException("boom")),
				RetryDecision.Reason.KIND_NOT_MATCHED, "options");

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY_SKIPPED");
		assertThat(event.getMessage().getFormattedMessage()).contains("exception kind not retried");
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new ArrayList<>();

		private CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
