package org.javai.retryable.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retryable.OnError;
import org.javai.retryable.RetryOptions;
import org.javai.retryable.retry.ErrorValues;
import org.javai.retryable.retry.FailureMatcher;
import org.javai.retryable.retry.MessageMatcher;
import org.javai.retryable.retry.Policy;
import org.javai.retryable.retry.SleepSpec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntToDoubleFunction;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns literal or named options into a {@link Policy}.
 *
 * <p>Options are layered: {@link RetryOptions#BUILT_IN}, then the provider's
 * {@value ConfigurationProvider#DEFAULTS} mapping, then the call's own options. Later layers
 * replace whole keys of earlier ones.
 *
 * <p>A name the provider does not know resolves to the defaults alone. That lookup is
 * permissive unless the resolver is created with {@code requireNamedConfigurations}.
 */
public final class OptionResolver {

    /**
     * Policy id for options passed literally rather than by name.
     */
    public static final String LITERAL_POLICY_ID = "options";

    private static final Logger LOGGER = LogManager.getLogger(OptionResolver.class);
    private static final Set<String> KNOWN_KEYS = Set.of(
            RetryOptions.ON, RetryOptions.MESSAGE, RetryOptions.TRIES, RetryOptions.SLEEP, RetryOptions.AFTER);
    private static final Runnable NO_OP = () -> {};

    private final ConfigurationProvider provider;
    private final boolean requireNamedConfigurations;

    public OptionResolver(ConfigurationProvider provider) {
        this(provider, false);
    }

    public OptionResolver(ConfigurationProvider provider, boolean requireNamedConfigurations) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.requireNamedConfigurations = requireNamedConfigurations;
    }

    /**
     * Resolves the configuration stored under {@code name}, merged over the defaults.
     *
     * @throws ConfigurationException if the stored options are malformed, or if nothing is
     *         stored under the name and named configurations are required
     */
    public Policy resolve(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> named = provider.get(name);
        if (named == null || named.isEmpty()) {
            if (requireNamedConfigurations) {
                throw new ConfigurationException("No retry configuration named [" + name + "]");
            }
            LOGGER.debug("No retry configuration named [{}]; using defaults", name);
            return toPolicy(name, defaults());
        }
        return toPolicy(name, defaults().merge(RetryOptions.of(named)));
    }

    /**
     * Resolves literal options merged over the defaults.
     *
     * @throws ConfigurationException if the options are malformed
     */
    public Policy resolve(RetryOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return toPolicy(LITERAL_POLICY_ID, defaults().merge(options));
    }

    /**
     * The built-in defaults overridden by the provider's defaults mapping.
     */
    public RetryOptions defaults() {
        Map<String, Object> configured = provider.get(ConfigurationProvider.DEFAULTS);
        if (configured == null || configured.isEmpty()) {
            return RetryOptions.BUILT_IN;
        }
        return RetryOptions.BUILT_IN.merge(RetryOptions.of(configured));
    }

    private Policy toPolicy(String id, RetryOptions options) {
        warnOnUnknownKeys(id, options);

        List<FailureMatcher> failureMatchers = new ArrayList<>();
        Optional<Predicate<Object>> errorPredicate = normalizeOn(id, options.get(RetryOptions.ON).orElse(null), failureMatchers);

        return new Policy(
                id,
                normalizeTries(id, options.get(RetryOptions.TRIES).orElse(null)),
                failureMatchers,
                normalizeMessages(id, options.get(RetryOptions.MESSAGE).orElse(null)),
                errorPredicate,
                normalizeSleep(id, options.get(RetryOptions.SLEEP).orElse(null)),
                normalizeAfter(id, options.get(RetryOptions.AFTER).orElse(null))
        );
    }

    private static void warnOnUnknownKeys(String id, RetryOptions options) {
        for (String key : options.asMap().keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                LOGGER.warn("Ignoring unknown retry option [{}] in policy [{}]", key, id);
            }
        }
    }

    // === on ===

    private static Optional<Predicate<Object>> normalizeOn(String id, Object raw, List<FailureMatcher> failureMatchers) {
        Set<FailureMatcher> matchers = new LinkedHashSet<>();
        Set<Predicate<Object>> explicitPredicates = new LinkedHashSet<>();
        boolean bareError = false;

        for (Object entry : wrap(raw)) {
            if (entry instanceof OnError onError) {
                if (onError.explicit()) {
                    explicitPredicates.add(onError.predicate());
                } else {
                    bareError = true;
                }
            } else if (ErrorValues.ERROR.equals(entry)) {
                bareError = true;
            } else if (entry instanceof FailureMatcher matcher) {
                matchers.add(matcher);
            } else if (entry instanceof Class<?> kind) {
                matchers.add(FailureMatcher.kind(exceptionClass(id, kind)));
            } else if (entry instanceof String className) {
                matchers.add(FailureMatcher.kind(loadExceptionClass(id, className)));
            } else {
                throw invalid(id, RetryOptions.ON, entry,
                        "an exception class, class name, FailureMatcher, \"error\" or OnError");
            }
        }
        failureMatchers.addAll(matchers);

        if (explicitPredicates.size() > 1) {
            throw new ConfigurationException("Retry option [on] in policy [" + id
                    + "] has " + explicitPredicates.size() + " error predicates; at most one is allowed");
        }
        if (!explicitPredicates.isEmpty()) {
            return Optional.of(explicitPredicates.iterator().next());
        }
        return bareError ? Optional.of(OnError.ERROR.predicate()) : Optional.empty();
    }

    private static Class<? extends Exception> exceptionClass(String id, Class<?> kind) {
        if (!Exception.class.isAssignableFrom(kind)) {
            throw new ConfigurationException("Retry option [on] in policy [" + id + "]: "
                    + kind.getName() + " is not an Exception");
        }
        return kind.asSubclass(Exception.class);
    }

    private static Class<? extends Exception> loadExceptionClass(String id, String className) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return exceptionClass(id, Class.forName(className.trim(), false,
                    loader != null ? loader : OptionResolver.class.getClassLoader()));
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Retry option [on] in policy [" + id + "]: unknown class "
                    + className, e);
        }
    }

    // === message ===

    private static List<MessageMatcher> normalizeMessages(String id, Object raw) {
        Set<MessageMatcher> matchers = new LinkedHashSet<>();
        for (Object entry : wrap(raw)) {
            if (entry instanceof MessageMatcher matcher) {
                matchers.add(matcher);
            } else if (entry instanceof String text) {
                matchers.add(MessageMatcher.substring(text));
            } else if (entry instanceof Pattern pattern) {
                matchers.add(MessageMatcher.pattern(pattern));
            } else if (entry instanceof Map<?, ?> spec) {
                matchers.add(MessageMatcher.pattern(patternFrom(id, spec)));
            } else {
                throw invalid(id, RetryOptions.MESSAGE, entry,
                        "a substring, Pattern, MessageMatcher or {\"pattern\": ..., \"flags\": ...}");
            }
        }
        return List.copyOf(matchers);
    }

    private static Pattern patternFrom(String id, Map<?, ?> spec) {
        if (!(spec.get("pattern") instanceof String regex)) {
            throw invalid(id, RetryOptions.MESSAGE, spec, "a \"pattern\" string");
        }
        Object flags = spec.get("flags");
        if (flags != null && !(flags instanceof String)) {
            throw invalid(id, RetryOptions.MESSAGE, spec, "\"flags\" as a string such as \"i\"");
        }
        try {
            return Pattern.compile(regex, patternFlags(id, flags == null ? "" : (String) flags));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Retry option [message] in policy [" + id
                    + "]: invalid pattern " + regex, e);
        }
    }

    private static int patternFlags(String id, String flags) {
        int result = 0;
        for (char flag : flags.toCharArray()) {
            result |= switch (flag) {
                case 'i' -> Pattern.CASE_INSENSITIVE;
                case 'm' -> Pattern.MULTILINE;
                case 's' -> Pattern.DOTALL;
                case 'x' -> Pattern.COMMENTS;
                case 'u' -> Pattern.UNICODE_CASE;
                default -> throw new ConfigurationException("Retry option [message] in policy [" + id
                        + "]: unknown pattern flag '" + flag + "'");
            };
        }
        return result;
    }

    // === tries, sleep, after ===

    private static int normalizeTries(String id, Object raw) {
        if (!(raw instanceof Number number) || !isIntegral(number)) {
            throw invalid(id, RetryOptions.TRIES, raw, "a whole number");
        }
        long tries = number.longValue();
        if (tries < 0 || tries > Integer.MAX_VALUE) {
            throw invalid(id, RetryOptions.TRIES, raw, "between 0 and " + Integer.MAX_VALUE);
        }
        return (int) tries;
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return true;
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        double value = number.doubleValue();
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    private static SleepSpec normalizeSleep(String id, Object raw) {
        try {
            if (raw instanceof Number seconds) {
                return SleepSpec.seconds(seconds.doubleValue());
            }
            if (raw instanceof Duration delay) {
                return SleepSpec.fixed(delay);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Retry option [sleep] in policy [" + id + "]: " + e.getMessage(), e);
        }
        if (raw instanceof IntToDoubleFunction secondsForRetry) {
            return SleepSpec.computed(secondsForRetry);
        }
        throw invalid(id, RetryOptions.SLEEP, raw, "seconds as a number, a Duration or an IntToDoubleFunction");
    }

    private static Runnable normalizeAfter(String id, Object raw) {
        if (raw == null) {
            return NO_OP;
        }
        if (raw instanceof Runnable hook) {
            return hook;
        }
        throw invalid(id, RetryOptions.AFTER, raw, "a Runnable");
    }

    private static Collection<?> wrap(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> collection) {
            return collection;
        }
        if (raw instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return List.of(raw);
    }

    private static ConfigurationException invalid(String id, String key, Object value, String expected) {
        return new ConfigurationException("Retry option [" + key + "] in policy [" + id + "] must be "
                + expected + ", was: " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
