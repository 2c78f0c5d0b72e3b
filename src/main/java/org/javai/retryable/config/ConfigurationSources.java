package org.javai.retryable.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Locates the retry configuration a default {@link org.javai.retryable.Retryable} reads.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>the file named by system property {@value #CONFIG_PROPERTY}</li>
 *   <li>the file named by environment variable {@value #CONFIG_ENV}</li>
 *   <li>the classpath resource {@value #CONFIG_RESOURCE}</li>
 * </ol>
 * When none is present, the empty provider is used and only built-in defaults apply.
 */
public final class ConfigurationSources {

	public static final String CONFIG_PROPERTY = "retryable.config";
	public static final String CONFIG_ENV = "RETRYABLE_CONFIG";
	public static final String CONFIG_RESOURCE = "retryable.json";

	private static final Logger LOGGER = LogManager.getLogger(ConfigurationSources.class);

	private ConfigurationSources() {
		// Utility class
	}

	/**
	 * Finds and loads the retry configuration.
	 *
	 * @return the configured provider, or the empty provider when nothing is configured
	 * @throws ConfigurationException if a configured source cannot be read or parsed
	 */
	public static ConfigurationProvider discover() {
		return discover(System::getenv);
	}

	static ConfigurationProvider discover(UnaryOperator<String> environment) {
		Optional<String> file = resolveSetting(CONFIG_PROPERTY, CONFIG_ENV, environment);
		if (file.isPresent()) {
			LOGGER.debug("Loading retry configuration from file {}", file.get());
			return JsonConfigurationProvider.fromPath(Path.of(file.get()));
		}
		if (JsonConfigurationProvider.classpathResourceExists(CONFIG_RESOURCE)) {
			LOGGER.debug("Loading retry configuration from classpath resource {}", CONFIG_RESOURCE);
			return JsonConfigurationProvider.fromClasspath(CONFIG_RESOURCE);
		}
		LOGGER.debug("No retry configuration found; using built-in defaults");
		return ConfigurationProvider.empty();
	}

	/**
	 * Resolves a setting from a system property, falling back to an environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @param environment looks up environment variables
	 * @return the value, or empty if neither is set to a non-blank value
	 */
	static Optional<String> resolveSetting(String sysProp, String envVar, UnaryOperator<String> environment) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}
}
