package org.javai.retryable.config;

/**
 * Thrown when retry options or a configuration source cannot be understood.
 * This is a misconfiguration, so it is unchecked.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
