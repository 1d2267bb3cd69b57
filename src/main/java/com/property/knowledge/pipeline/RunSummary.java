package com.property.knowledge.pipeline;

import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.GenerationResult;
import com.property.knowledge.merge.MergeResult;
import com.property.knowledge.source.LoadResult;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of a complete generation run.
 *
 * @param runId       correlation id used in the run's log lines
 * @param loads       per-source load statistics ordered by tag, for sources that were read to the end
 * @param mergeResult the merged knowledge base and its conflicts
 * @param artifacts   artifacts written, in format order
 */
public record RunSummary(
        String runId,
        SortedMap<SourceTag, LoadResult> loads,
        MergeResult mergeResult,
        List<GenerationResult> artifacts
) {
    public RunSummary {
        Objects.requireNonNull(mergeResult, "mergeResult is required");
        loads = loads != null ? Collections.unmodifiableSortedMap(new TreeMap<>(loads)) : Collections.emptySortedMap();
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    }

    public int entryCount() {
        return mergeResult.knowledgeBase().size();
    }

    public int conflictCount() {
        return mergeResult.conflicts().size();
    }

    public long droppedRecords() {
        return loads.values().stream().mapToLong(LoadResult::droppedCount).sum();
    }

    public List<SourceTag> unavailableSources() {
        return mergeResult.unavailableSources();
    }
}
