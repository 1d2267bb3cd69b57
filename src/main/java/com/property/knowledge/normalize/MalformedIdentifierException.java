package com.property.knowledge.normalize;

/**
 * Runtime exception thrown when a record's key fields (format identifier or
 * property identifier) cannot be normalized. The record is dropped, never merged.
 */
public class MalformedIdentifierException extends RuntimeException {

    public MalformedIdentifierException(String message) {
        super(message);
    }

    public MalformedIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
