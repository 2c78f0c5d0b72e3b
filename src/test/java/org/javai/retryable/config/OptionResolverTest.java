package org.javai.retryable.config;

import org.javai.retryable.OnError;
import org.javai.retryable.RetryOptions;
import org.javai.retryable.retry.FailureMatcher;
import org.javai.retryable.retry.MessageMatcher;
import org.javai.retryable.retry.Policy;
import org.javai.retryable.retry.SleepSpec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntToDoubleFunction;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class OptionResolverTest {

    private final OptionResolver resolver = new OptionResolver(ConfigurationProvider.empty());

    @Test
    void resolve_emptyOptions_usesBuiltInDefaults() {
        Policy policy = resolver.resolve(RetryOptions.empty());

        assertThat(policy.id()).isEqualTo(OptionResolver.LITERAL_POLICY_ID);
        assertThat(policy.maxTries()).isEqualTo(1);
        assertThat(policy.failureMatchers()).isEmpty();
        assertThat(policy.messageMatchers()).isEmpty();
        assertThat(policy.errorPredicate()).isEmpty();
        assertThat(policy.sleepSpec()).isEqualTo(SleepSpec.seconds(1));
        assertThatCode(() -> policy.finallyHook().run()).doesNotThrowAnyException();
    }

    @Test
    void resolve_literalOptions_overrideProviderDefaults() {
        OptionResolver withDefaults = new OptionResolver(MapConfigurationProvider.builder()
                .defaults(RetryOptions.builder().tries(10).sleep(0.5).on(IOException.class).build())
                .build());

        Policy policy = withDefaults.resolve(RetryOptions.builder().tries(3).build());

        assertThat(policy.maxTries()).isEqualTo(3);
        assertThat(policy.sleepSpec().delayFor(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.failureMatchers()).containsExactly(FailureMatcher.kind(IOException.class));
    }

    @Test
    void resolve_named_mergesOverDefaults() {
        OptionResolver named = new OptionResolver(MapConfigurationProvider.builder()
                .defaults(RetryOptions.builder().on(IllegalArgumentException.class).build())
                .named("my_config", RetryOptions.builder().tries(10).build())
                .build());

        Policy policy = named.resolve("my_config");

        assertThat(policy.id()).isEqualTo("my_config");
        assertThat(policy.maxTries()).isEqualTo(10);
        assertThat(policy.failureMatchers()).containsExactly(FailureMatcher.kind(IllegalArgumentException.class));
    }

    @Test
    void resolve_unknownName_fallsBackToDefaults() {
        OptionResolver named = new OptionResolver(MapConfigurationProvider.builder()
                .defaults(RetryOptions.builder().tries(4).build())
                .build());

        Policy policy = named.resolve("missing");

        assertThat(policy.id()).isEqualTo("missing");
        assertThat(policy.maxTries()).isEqualTo(4);
    }

    @Test
    void resolve_unknownName_rejectedWhenNamedConfigurationsRequired() {
        OptionResolver strict = new OptionResolver(ConfigurationProvider.empty(), true);

        assertThatThrownBy(() -> strict.resolve("missing"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void resolve_singleKind_isWrappedIntoList() {
        Policy policy = resolver.resolve(RetryOptions.of(Map.of(RetryOptions.ON, IOException.class)));

        assertThat(policy.failureMatchers()).containsExactly(FailureMatcher.kind(IOException.class));
        assertThat(policy.errorPredicate()).isEmpty();
    }

    @Test
    void resolve_duplicateKindsAndMessages_areRemoved() {
        Policy policy = resolver.resolve(RetryOptions.builder()
                .on(IOException.class)
                .on(IOException.class)
                .message("bad")
                .message("bad")
                .message(Pattern.compile("worse"))
                .message(Pattern.compile("worse"))
                .build());

        assertThat(policy.failureMatchers()).hasSize(1);
        assertThat(policy.messageMatchers())
                .containsExactly(MessageMatcher.substring("bad"), MessageMatcher.pattern("worse"));
    }

    @Test
    void resolve_bareError_usesDefaultPredicateAndNoKinds() {
        Policy policy = resolver.resolve(RetryOptions.builder().onError().build());

        assertThat(policy.failureMatchers()).isEmpty();
        assertThat(policy.errorPredicate()).isPresent();
        assertThat(policy.errorPredicate().get().test(List.of("error", "no"))).isTrue();
        assertThat(policy.errorPredicate().get().test(Map.of("ok", "yes"))).isFalse();
    }

    @Test
    void resolve_errorString_isTheSentinel() {
        Policy policy = resolver.resolve(RetryOptions.of(Map.of(RetryOptions.ON, List.of("error", IOException.class))));

        assertThat(policy.errorPredicate()).isPresent();
        assertThat(policy.failureMatchers()).containsExactly(FailureMatcher.kind(IOException.class));
    }

    @Test
    void resolve_explicitPredicate_winsOverBareError() {
        Predicate<Object> isNull = value -> value == null;

        Policy policy = resolver.resolve(RetryOptions.builder().onError().onError(isNull).build());

        assertThat(policy.errorPredicate()).containsSame(isNull);
    }

    @Test
    void resolve_twoExplicitPredicates_areRejected() {
        RetryOptions options = RetryOptions.builder()
                .onError(value -> value == null)
                .onError(value -> "".equals(value))
                .build();

        assertThatThrownBy(() -> resolver.resolve(options))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at most one");
    }

    @Test
    void resolve_sameExplicitPredicateTwice_isAccepted() {
        OnError onNull = OnError.when(value -> value == null);

        Policy policy = resolver.resolve(RetryOptions.of(Map.of(RetryOptions.ON, List.of(onNull, onNull))));

        assertThat(policy.errorPredicate()).containsSame(onNull.predicate());
    }

    @Test
    void resolve_classNames_areLoaded() {
        Policy policy = resolver.resolve(RetryOptions.of(Map.of(RetryOptions.ON, "java.net.SocketTimeoutException")));

        assertThat(policy.failureMatchers()).containsExactly(FailureMatcher.kind(SocketTimeoutException.class));
    }

    @Test
    void resolve_unknownClassName_isRejected() {
        RetryOptions options = RetryOptions.of(Map.of(RetryOptions.ON, "com.example.NoSuchException"));

        assertThatThrownBy(() -> resolver.resolve(options))
                .isInstanceOf(ConfigurationException.class)
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void resolve_nonExceptionClass_isRejected() {
        RetryOptions options = RetryOptions.of(Map.of(RetryOptions.ON, String.class));

        assertThatThrownBy(() -> resolver.resolve(options))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("java.lang.String is not an Exception");
    }

    @Test
    void resolve_failureMatcher_isKeptAsGiven() {
        FailureMatcher anyIo = FailureMatcher.kindOrSubtype(IOException.class);

        Policy policy = resolver.resolve(RetryOptions.builder().on(anyIo).build());

        assertThat(policy.failureMatchers()).containsExactly(anyIo);
    }

    @Test
    void resolve_patternSpecFromMap_compilesWithFlags() {
        RetryOptions options = RetryOptions.of(Map.of(
                RetryOptions.MESSAGE, List.of("timeout", Map.of("pattern", "throttl", "flags", "i"))));

        Policy policy = resolver.resolve(options);

        assertThat(policy.messageMatchers()).hasSize(2);
        assertThat(policy.messageMatchers().get(1).matches("THROTTLED")).isTrue();
    }

    @Test
    void resolve_unknownPatternFlag_isRejected() {
        RetryOptions options = RetryOptions.of(Map.of(
                RetryOptions.MESSAGE, Map.of("pattern", "x", "flags", "q")));

        assertThatThrownBy(() -> resolver.resolve(options))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'q'");
    }

    @Test
    void resolve_triesFromJsonDouble_isAcceptedWhenWhole() {
        assertThat(resolver.resolve(RetryOptions.of(Map.of(RetryOptions.TRIES, 3.0))).maxTries()).isEqualTo(3);
        assertThat(resolver.resolve(RetryOptions.of(Map.of(RetryOptions.TRIES, 0L))).maxTries()).isZero();
    }

    @Test
    void resolve_invalidTries_isRejected() {
        assertThatThrownBy(() -> resolver.resolve(RetryOptions.of(Map.of(RetryOptions.TRIES, -1))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> resolver.resolve(RetryOptions.of(Map.of(RetryOptions.TRIES, 1.5))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> resolver.resolve(RetryOptions.of(Map.of(RetryOptions.TRIES, "3"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("[tries]");
    }

    @Test
    void resolve_sleepForms() {
        IntToDoubleFunction backoff = n -> n + 1;

        assertThat(resolver.resolve(RetryOptions.builder().sleep(2).build()).sleepSpec())
                .isEqualTo(SleepSpec.fixed(Duration.ofSeconds(2)));
        assertThat(resolver.resolve(RetryOptions.builder().sleep(Duration.ofMillis(20)).build()).sleepSpec())
                .isEqualTo(SleepSpec.fixed(Duration.ofMillis(20)));
        assertThat(resolver.resolve(RetryOptions.builder().sleep(backoff).build()).sleepSpec().delayFor(1))
                .isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void resolve_negativeSleep_isRejected() {
        assertThatThrownBy(() -> resolver.resolve(RetryOptions.builder().sleep(-1).build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("[sleep]");
    }

    @Test
    void resolve_after_isKept() {
        AtomicInteger calls = new AtomicInteger();

        Policy policy = resolver.resolve(RetryOptions.builder().after(calls::incrementAndGet).build());
        policy.finallyHook().run();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void resolve_nonRunnableAfter_isRejected() {
        assertThatThrownBy(() -> resolver.resolve(RetryOptions.of(Map.of(RetryOptions.AFTER, "cleanup"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Runnable");
    }

    @Test
    void resolve_unknownKeys_areIgnored() {
        Policy policy = resolver.resolve(RetryOptions.of(Map.of("retries", 7, RetryOptions.TRIES, 2)));

        assertThat(policy.maxTries()).isEqualTo(2);
    }

    @Test
    void defaults_layerProviderOverBuiltIn() {
        OptionResolver withDefaults = new OptionResolver(MapConfigurationProvider.builder()
                .defaults(RetryOptions.builder().sleep(0.001).build())
                .build());

        RetryOptions defaults = withDefaults.defaults();

        assertThat(defaults.get(RetryOptions.SLEEP)).contains(0.001);
        assertThat(defaults.get(RetryOptions.TRIES)).contains(1);
    }
}
