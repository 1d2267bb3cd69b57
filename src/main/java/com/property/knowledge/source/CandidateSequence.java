package com.property.knowledge.source;

import com.property.knowledge.core.model.CandidateEntry;
import com.property.knowledge.core.model.SourceTag;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A restartable sequence of candidate entries from one source.
 * Every call to {@link #stream()} starts a fresh pass; callers close the stream when done.
 */
public interface CandidateSequence {

    SourceTag tag();

    /**
     * Opens a new lazy pass over the candidates.
     *
     * @throws SourceUnavailableException if the underlying source cannot be read
     */
    Stream<CandidateEntry> stream();

    /**
     * Creates an in-memory sequence. Every entry must belong to the given source.
     */
    static CandidateSequence of(SourceTag tag, List<CandidateEntry> entries) {
        Objects.requireNonNull(tag, "tag is required");
        List<CandidateEntry> copy = List.copyOf(entries);
        for (CandidateEntry entry : copy) {
            if (!entry.source().equals(tag)) {
                throw new IllegalArgumentException(
                        "Entry " + entry.key() + " belongs to " + entry.source() + ", not " + tag);
            }
        }
        return new CandidateSequence() {
            @Override
            public SourceTag tag() {
                return tag;
            }

            @Override
            public Stream<CandidateEntry> stream() {
                return copy.stream();
            }

            @Override
            public String toString() {
                return "CandidateSequence{tag=" + tag + ", entries=" + copy.size() + '}';
            }
        };
    }
}
