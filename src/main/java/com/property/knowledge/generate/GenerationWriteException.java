package com.property.knowledge.generate;

import java.nio.file.Path;

/**
 * Runtime exception thrown when a generated artifact cannot be written.
 */
public class GenerationWriteException extends RuntimeException {

    private final Path path;

    public GenerationWriteException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public GenerationWriteException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    /**
     * The path that could not be written.
     */
    public Path getPath() {
        return path;
    }
}
