package org.javai.retryable;

import org.javai.retryable.config.ConfigurationProvider;
import org.javai.retryable.config.ConfigurationSources;
import org.javai.retryable.config.OptionResolver;
import org.javai.retryable.ops.RetryReporter;
import org.javai.retryable.ops.log4j.Log4jRetryReporter;
import org.javai.retryable.retry.Policy;
import org.javai.retryable.retry.RetryEngine;
import org.javai.retryable.retry.Sleeper;

import java.util.Map;
import java.util.Objects;

/**
 * Retries a unit of work with simple, declarative options.
 *
 * <p>Options name what to retry on, how often and how long to wait:</p>
 * <ul>
 *   <li>{@code on}: exception classes, or {@code "error"} to retry error values the work
 *       returns. Default: every exception.</li>
 *   <li>{@code message}: substrings or patterns the exception message must match.
 *       Default: every message.</li>
 *   <li>{@code tries}: retries after the first attempt. Default: 1.</li>
 *   <li>{@code sleep}: seconds between attempts, or a function of the retry index. Default: 1.</li>
 *   <li>{@code after}: run exactly once when the call completes. Default: nothing.</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retryable retryable = Retryable.builder()
 *     .configuration(JsonConfigurationProvider.fromClasspath("retryable.json"))
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * Response response = retryable.retryable(
 *     RetryOptions.builder().on(SocketTimeoutException.class).tries(5).sleep(2).build(),
 *     () -> api.call());
 *
 * // Named configuration, merged over the configured defaults
 * Response other = retryable.retryable("aws", () -> s3.getObject(request));
 * }</pre>
 *
 * <p>A failure that is not retried reaches the caller unchanged. When retries on an error
 * value run out, the last value is returned rather than thrown.
 */
public final class Retryable {

    private static volatile Retryable shared;

    private final OptionResolver resolver;
    private final RetryEngine engine;

    private Retryable(OptionResolver resolver, RetryEngine engine) {
        this.resolver = resolver;
        this.engine = engine;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an instance reading the configuration found by {@link ConfigurationSources#discover()}
     * and logging retries through {@link Log4jRetryReporter}.
     */
    public static Retryable withDefaults() {
        return builder()
                .configuration(ConfigurationSources.discover())
                .reporter(new Log4jRetryReporter())
                .build();
    }

    /**
     * Retries with the given options, merged over the configured defaults.
     *
     * @param options the options for this call
     * @param work the work to retry
     * @return the value of the last attempt
     * @throws E the exception of the last attempt, unchanged
     */
    public <T, E extends Exception> T retryable(RetryOptions options, ThrowingSupplier<T, E> work) throws E {
        Policy policy = resolver.resolve(options);
        return engine.execute(policy, work);
    }

    /**
     * Retries with raw options, merged over the configured defaults.
     */
    public <T, E extends Exception> T retryable(Map<String, ?> options, ThrowingSupplier<T, E> work) throws E {
        return retryable(RetryOptions.of(options), work);
    }

    /**
     * Retries with the configuration stored under {@code name}, merged over the configured defaults.
     * An unknown name falls back to the defaults.
     */
    public <T, E extends Exception> T retryable(String name, ThrowingSupplier<T, E> work) throws E {
        Policy policy = resolver.resolve(name);
        return engine.execute(policy, work);
    }

    /**
     * Retries with the configured defaults alone.
     */
    public <T, E extends Exception> T retryable(ThrowingSupplier<T, E> work) throws E {
        return retryable(RetryOptions.empty(), work);
    }

    // === STATIC CONVENIENCE METHODS ===

    /**
     * Retries with options, using the shared instance from {@link #withDefaults()}.
     *
     * @throws org.javai.retryable.config.ConfigurationException if the shared instance cannot
     *         be created; creation is attempted again on the next call
     */
    public static <T, E extends Exception> T attempt(RetryOptions options, ThrowingSupplier<T, E> work) throws E {
        return shared().retryable(options, work);
    }

    /**
     * Retries with a named configuration, using the shared instance from {@link #withDefaults()}.
     */
    public static <T, E extends Exception> T attempt(String name, ThrowingSupplier<T, E> work) throws E {
        return shared().retryable(name, work);
    }

    private static Retryable shared() {
        Retryable instance = shared;
        if (instance == null) {
            synchronized (Retryable.class) {
                instance = shared;
                if (instance == null) {
                    instance = withDefaults();
                    shared = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Package-private for testing.
     */
    static void resetShared() {
        synchronized (Retryable.class) {
            shared = null;
        }
    }

    /**
     * Builder for configuring a Retryable instance.
     */
    public static final class Builder {
        private ConfigurationProvider configuration = ConfigurationProvider.empty();
        private Sleeper sleeper = Thread::sleep;
        private RetryReporter reporter = RetryReporter.noOp();
        private boolean requireNamedConfigurations;

        private Builder() {}

        /**
         * Sets where defaults and named configurations come from (optional, defaults to none).
         */
        public Builder configuration(ConfigurationProvider configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
            return this;
        }

        /**
         * Sets how the engine waits between attempts (optional, defaults to {@link Thread#sleep(long)}).
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * When set, a name with no stored configuration is rejected instead of falling back
         * to the defaults.
         */
        public Builder requireNamedConfigurations(boolean requireNamedConfigurations) {
            this.requireNamedConfigurations = requireNamedConfigurations;
            return this;
        }

        public Retryable build() {
            return new Retryable(
                    new OptionResolver(configuration, requireNamedConfigurations),
                    new RetryEngine(sleeper, reporter));
        }
    }
}
