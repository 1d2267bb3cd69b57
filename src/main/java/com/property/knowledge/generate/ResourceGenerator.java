package com.property.knowledge.generate;

import com.property.knowledge.kb.KnowledgeBase;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Serializes a knowledge base into one artifact format.
 * Output must depend only on the knowledge base, so regenerating yields identical bytes.
 */
public interface ResourceGenerator {

    TargetFormat getFormat();

    /**
     * Writes the knowledge base to the given writer. The writer is not closed.
     *
     * @return number of entries written
     */
    long write(KnowledgeBase knowledgeBase, Writer writer) throws IOException;

    /**
     * Writes the knowledge base to a file. The content goes to a temporary sibling
     * first and is moved into place only once completely written and flushed.
     *
     * @throws GenerationWriteException if the file cannot be written
     */
    default GenerationResult generate(KnowledgeBase knowledgeBase, Path target) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            long written;
            try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
                written = write(knowledgeBase, writer);
            }
            try {
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            return new GenerationResult(getFormat(), target, written);
        } catch (IOException e) {
            GenerationWriteException failure = new GenerationWriteException(target, "Cannot write " + getFormat() + " artifact", e);
            if (temporary != null) {
                try {
                    Files.deleteIfExists(temporary);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }
}
