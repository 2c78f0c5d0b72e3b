package org.javai.retryable;

import org.javai.retryable.retry.FailureMatcher;
import org.javai.retryable.retry.MessageMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntToDoubleFunction;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A literal, ordered set of retry options, before resolution into a policy.
 *
 * <p>Options are kept in their raw form; shorthand such as a single class instead of a list
 * is normalized later by the {@link org.javai.retryable.config.OptionResolver}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryOptions options = RetryOptions.builder()
 *     .on(SocketTimeoutException.class)
 *     .message("timeout")
 *     .message(Pattern.compile("throttl", Pattern.CASE_INSENSITIVE))
 *     .tries(5)
 *     .sleep(n -> Math.pow(2, n))
 *     .build();
 * }</pre>
 */
public final class RetryOptions {

    public static final String ON = "on";
    public static final String MESSAGE = "message";
    public static final String TRIES = "tries";
    public static final String SLEEP = "sleep";
    public static final String AFTER = "after";

    private static final RetryOptions EMPTY = new RetryOptions(Map.of());

    /**
     * Defaults applied beneath the provider's {@code defaults} mapping.
     */
    public static final RetryOptions BUILT_IN = builder()
            .option(ON, List.of())
            .option(MESSAGE, List.of())
            .tries(1)
            .sleep(1)
            .build();

    private final Map<String, Object> values;

    private RetryOptions(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RetryOptions empty() {
        return EMPTY;
    }

    /**
     * Wraps a raw option mapping, as read from a configuration provider.
     *
     * @param values option keys to raw values
     * @return the options, in the mapping's iteration order
     */
    public static RetryOptions of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return values.isEmpty() ? EMPTY : new RetryOptions(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options holding every key of this instance, with the keys of
     * {@code overrides} replacing those already present.
     *
     * @param overrides options that take precedence
     * @return the merged options
     */
    public RetryOptions merge(RetryOptions overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        if (overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides.values);
        return new RetryOptions(merged);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RetryOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RetryOptions" + values;
    }

    /**
     * Builder for {@link RetryOptions}.
     * Repeated calls to {@code on} and {@code message} accumulate; other keys keep the last value.
     */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final List<Object> on = new ArrayList<>();
        private final List<Object> message = new ArrayList<>();

        private Builder() {}

        /**
         * Retry when the work throws exactly this exception class.
         */
        public Builder on(Class<? extends Exception> kind) {
            on.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        public Builder on(FailureMatcher matcher) {
            on.add(Objects.requireNonNull(matcher, "matcher must not be null"));
            return this;
        }

        /**
         * Retry when the work returns a recognized error value.
         */
        public Builder onError() {
            on.add(OnError.ERROR);
            return this;
        }

        /**
         * Retry when the work returns a value matching the predicate.
         */
        public Builder onError(Predicate<Object> predicate) {
            on.add(OnError.when(predicate));
            return this;
        }

        /**
         * Retry only when the exception message contains this text.
         */
        public Builder message(String substring) {
            message.add(Objects.requireNonNull(substring, "substring must not be null"));
            return this;
        }

        /**
         * Retry only when the pattern is found in the exception message.
         */
        public Builder message(Pattern pattern) {
            message.add(Objects.requireNonNull(pattern, "pattern must not be null"));
            return this;
        }

        public Builder message(MessageMatcher matcher) {
            message.add(Objects.requireNonNull(matcher, "matcher must not be null"));
            return this;
        }

        /**
         * Number of retries after the first attempt.
         */
        public Builder tries(int tries) {
            values.put(TRIES, tries);
            return this;
        }

        /**
         * Fixed sleep between attempts, in seconds.
         */
        public Builder sleep(double seconds) {
            values.put(SLEEP, seconds);
            return this;
        }

        public Builder sleep(Duration delay) {
            values.put(SLEEP, Objects.requireNonNull(delay, "delay must not be null"));
            return this;
        }

        /**
         * Sleep computed from the zero-based retry index, in seconds.
         */
        public Builder sleep(IntToDoubleFunction secondsForRetry) {
            values.put(SLEEP, Objects.requireNonNull(secondsForRetry, "secondsForRetry must not be null"));
            return this;
        }

        /**
         * Action run exactly once when the call completes, however many attempts it took.
         */
        public Builder after(Runnable hook) {
            values.put(AFTER, Objects.requireNonNull(hook, "hook must not be null"));
            return this;
        }

        /**
         * Sets a raw option value.
         */
        public Builder option(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (ON.equals(key)) {
                on.clear();
            } else if (MESSAGE.equals(key)) {
                message.clear();
            }
            values.put(key, value);
            return this;
        }

        public RetryOptions build() {
            Map<String, Object> built = new LinkedHashMap<>(values);
            if (!on.isEmpty()) {
                built.put(ON, List.copyOf(on));
            }
            if (!message.isEmpty()) {
                built.put(MESSAGE, List.copyOf(message));
            }
            return RetryOptions.of(built);
        }
    }
}
