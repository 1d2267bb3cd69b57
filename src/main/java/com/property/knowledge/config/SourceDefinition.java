package com.property.knowledge.config;

import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.rules.CleanupRuleSet;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of one recognized source.
 *
 * @param tag   the source tag recorded on its candidates
 * @param path  location of the source's record stream
 * @param rank  precedence rank, 1 = highest
 * @param rules cleanup rules for the source's optional fields
 */
public record SourceDefinition(SourceTag tag, Path path, int rank, CleanupRuleSet rules) {

    public SourceDefinition {
        Objects.requireNonNull(tag, "tag is required");
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(rules, "rules is required");
    }
}
