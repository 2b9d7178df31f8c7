package io.fullerstack.factory.config;

/**
 * Thrown when a configuration key is missing or holds a malformed value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
