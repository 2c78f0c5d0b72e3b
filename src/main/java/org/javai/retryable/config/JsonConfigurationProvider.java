package org.javai.retryable.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link ConfigurationProvider} read from a JSON document.
 *
 * <p>The document is an object whose keys are configuration names and whose values are
 * option objects:</p>
 * <pre>{@code
 * {
 *   "defaults": { "sleep": 0.5 },
 *   "aws": {
 *     "on": ["java.net.SocketTimeoutException", "error"],
 *     "message": ["timeout", { "pattern": "throttl", "flags": "i" }],
 *     "tries": 5,
 *     "sleep": 2
 *   }
 * }
 * }</pre>
 *
 * <p>Values are kept as Jackson maps them (strings, numbers, lists, maps); the
 * {@link OptionResolver} interprets them.
 */
public final class JsonConfigurationProvider implements ConfigurationProvider {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> OPTIONS_TYPE = new TypeReference<>() {};

    private final MapConfigurationProvider delegate;

    private JsonConfigurationProvider(MapConfigurationProvider delegate) {
        this.delegate = delegate;
    }

    /**
     * Parses a JSON document.
     *
     * @param json the document
     * @return the provider
     * @throws ConfigurationException if the document is not valid JSON or not an object of objects
     */
    public static JsonConfigurationProvider fromString(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromTree(OBJECT_MAPPER.readTree(json), "string");
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid retry configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a JSON file.
     *
     * @throws ConfigurationException if the file cannot be read or parsed
     */
    public static JsonConfigurationProvider fromPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Could not read retry configuration from " + path, e);
        }
    }

    /**
     * Reads a JSON resource from the context class loader.
     *
     * @throws ConfigurationException if the resource does not exist or cannot be parsed
     */
    public static JsonConfigurationProvider fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream stream = classLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new ConfigurationException("Retry configuration resource not found: " + resource);
        }
        try (InputStream in = stream) {
            return fromStream(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read retry configuration resource " + resource, e);
        }
    }

    static boolean classpathResourceExists(String resource) {
        return classLoader().getResource(resource) != null;
    }

    @Override
    public Map<String, Object> get(String name) {
        return delegate.get(name);
    }

    public Set<String> names() {
        return delegate.names();
    }

    private static JsonConfigurationProvider fromStream(InputStream in, String source) throws IOException {
        try {
            return fromTree(OBJECT_MAPPER.readTree(in), source);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid retry configuration JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private static JsonConfigurationProvider fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Retry configuration in " + source + " must be a JSON object");
        }
        MapConfigurationProvider.Builder builder = MapConfigurationProvider.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                throw new ConfigurationException("Configuration [" + field.getKey() + "] in " + source + " must be a JSON object");
            }
            builder.named(field.getKey(), OBJECT_MAPPER.convertValue(field.getValue(), OPTIONS_TYPE));
        }
        return new JsonConfigurationProvider(builder.build());
    }

    private static ClassLoader classLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : JsonConfigurationProvider.class.getClassLoader();
    }
}
