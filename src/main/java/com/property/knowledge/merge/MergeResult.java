package com.property.knowledge.merge;

import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.kb.KnowledgeBase;

import java.util.List;
import java.util.Objects;

/**
 * Result of a merge: the knowledge base plus everything needed to account for it.
 *
 * @param knowledgeBase       the merged knowledge base
 * @param conflicts           field conflicts settled by precedence, in key order
 * @param candidatesConsumed  candidate entries read from the available sources
 * @param unavailableSources  sources whose stream could not be read and contributed nothing
 * @param policyName          name of the precedence policy used
 */
public record MergeResult(
        KnowledgeBase knowledgeBase,
        List<FieldConflict> conflicts,
        long candidatesConsumed,
        List<SourceTag> unavailableSources,
        String policyName
) {
    public MergeResult {
        Objects.requireNonNull(knowledgeBase, "knowledgeBase is required");
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        unavailableSources = unavailableSources != null ? List.copyOf(unavailableSources) : List.of();
    }

    public boolean isDegraded() {
        return !unavailableSources.isEmpty();
    }
}
