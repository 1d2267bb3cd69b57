package com.property.knowledge.source;

import com.property.knowledge.core.model.SourceTag;

import java.io.BufferedReader;
import java.util.stream.Stream;

/**
 * Splits one source's serialized record stream into record blocks.
 * Implementations must be lazy and must not close the reader; the caller owns it.
 */
@FunctionalInterface
public interface RecordReader {

    /**
     * Reads record blocks from the given reader.
     *
     * @param reader the source text
     * @param source the source the records belong to
     * @return a lazy stream of blocks; I/O failures surface as {@link SourceUnavailableException}
     */
    Stream<RecordBlock> read(BufferedReader reader, SourceTag source);
}
