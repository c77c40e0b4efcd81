package io.rollcron.config;

/**
 * Thrown when the config file cannot be read or describes an invalid job list.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
