package org.javai.retryable.config;

import java.util.Map;

/**
 * Supplies stored retry configurations by name.
 *
 * <p>The name {@value #DEFAULTS} holds options applied beneath every call; any other
 * name holds a named policy. Unknown names yield an empty mapping, never null.
 */
@FunctionalInterface
public interface ConfigurationProvider {

    String DEFAULTS = "defaults";

    /**
     * Returns the options stored under {@code name}.
     *
     * @param name the configuration name
     * @return an ordered option mapping, empty when nothing is stored under the name
     */
    Map<String, Object> get(String name);

    /**
     * A provider with no stored configurations.
     */
    static ConfigurationProvider empty() {
        return name -> Map.of();
    }
}
