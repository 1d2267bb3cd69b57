package com.property.knowledge.merge;

/**
 * Runtime exception thrown when the precedence policy does not match the
 * recognized sources. Raised before any merging starts.
 */
public class PrecedenceConfigurationException extends RuntimeException {

    public PrecedenceConfigurationException(String message) {
        super(message);
    }

    public PrecedenceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
