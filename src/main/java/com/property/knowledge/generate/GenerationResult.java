package com.property.knowledge.generate;

import java.nio.file.Path;

/**
 * Result of writing one generated artifact.
 *
 * @param format         the artifact format
 * @param path           where the artifact was written
 * @param entriesWritten number of knowledge base entries in the artifact
 */
public record GenerationResult(TargetFormat format, Path path, long entriesWritten) {

    @Override
    public String toString() {
        return "GenerationResult{format=" + format +
                ", path=" + path +
                ", entries=" + entriesWritten + '}';
    }
}
