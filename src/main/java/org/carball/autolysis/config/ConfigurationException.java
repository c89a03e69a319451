package org.carball.autolysis.config;

/**
 * Invalid profiling or clustering parameters. Raised before any computation starts and never
 * silently clamped.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
