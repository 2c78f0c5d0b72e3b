package org.javai.retryable.config;

import org.javai.retryable.RetryOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An in-memory {@link ConfigurationProvider}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ConfigurationProvider provider = MapConfigurationProvider.builder()
 *     .defaults(RetryOptions.builder().sleep(0.5).build())
 *     .named("aws", RetryOptions.builder().message("timeout").tries(5).sleep(2).build())
 *     .build();
 * }</pre>
 */
public final class MapConfigurationProvider implements ConfigurationProvider {

    private final Map<String, Map<String, Object>> configurations;

    private MapConfigurationProvider(Map<String, Map<String, Object>> configurations) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        configurations.forEach((name, options) ->
                copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(options))));
        this.configurations = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a provider from raw mappings keyed by configuration name.
     */
    public static MapConfigurationProvider of(Map<String, ? extends Map<String, ?>> configurations) {
        Objects.requireNonNull(configurations, "configurations must not be null");
        Builder builder = builder();
        configurations.forEach((name, options) -> builder.named(name, options));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, Object> get(String name) {
        return configurations.getOrDefault(name, Map.of());
    }

    /**
     * The names of all stored configurations, including {@value ConfigurationProvider#DEFAULTS} when present.
     */
    public Set<String> names() {
        return configurations.keySet();
    }

    public static final class Builder {
        private final Map<String, Map<String, Object>> configurations = new LinkedHashMap<>();

        private Builder() {}

        public Builder defaults(RetryOptions options) {
            return named(DEFAULTS, options);
        }

        public Builder named(String name, RetryOptions options) {
            Objects.requireNonNull(options, "options must not be null");
            return named(name, options.asMap());
        }

        public Builder named(String name, Map<String, ?> options) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(options, "options must not be null");
            configurations.put(name, new LinkedHashMap<>(options));
            return this;
        }

        public MapConfigurationProvider build() {
            return new MapConfigurationProvider(configurations);
        }
    }
}
