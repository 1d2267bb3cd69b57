package com.property.knowledge.source;

import com.property.knowledge.core.model.SourceTag;

/**
 * Runtime exception thrown when a source's record stream cannot be read at all.
 * The source's contribution is dropped; the run continues unless every source fails.
 */
public class SourceUnavailableException extends RuntimeException {

    private final SourceTag source;

    public SourceUnavailableException(String message) {
        this(null, message, null);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public SourceUnavailableException(SourceTag source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * The source that failed, or {@code null} when the failure concerns the run as a whole.
     */
    public SourceTag getSource() {
        return source;
    }
}
