package com.property.knowledge.config;

/**
 * Runtime exception thrown when the pipeline configuration cannot be read or is invalid.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
