package com.property.knowledge.source;

import com.property.knowledge.core.model.SourceTag;

import java.util.List;

/**
 * Result of one pass over a source's record stream.
 *
 * @param source             the source that was read
 * @param recordsRead        number of record blocks encountered
 * @param candidatesProduced number of records that normalized into candidate entries
 * @param errors             records that were dropped, with the reason
 */
public record LoadResult(
        SourceTag source,
        long recordsRead,
        long candidatesProduced,
        List<LoadError> errors
) {
    public LoadResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long droppedCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that was dropped while loading.
     *
     * @param ordinal  1-based position of the record in its source
     * @param location human-readable location ({@code source#ordinal})
     * @param message  why the record was dropped
     */
    public record LoadError(long ordinal, String location, String message) {}

    @Override
    public String toString() {
        return "LoadResult{source=" + source +
                ", read=" + recordsRead +
                ", candidates=" + candidatesProduced +
                ", dropped=" + errors.size() + '}';
    }
}
