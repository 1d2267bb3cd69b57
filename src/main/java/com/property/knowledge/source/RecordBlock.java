package com.property.knowledge.source;

import com.property.knowledge.normalize.RawRecord;

/**
 * One self-delimited block of a source stream: either a parsed raw record or
 * the reason the block could not be parsed.
 *
 * @param ordinal      1-based position of the block within the stream
 * @param record       the parsed record, or {@code null} if unreadable
 * @param errorMessage why the block could not be parsed, or {@code null}
 */
public record RecordBlock(long ordinal, RawRecord record, String errorMessage) {

    public static RecordBlock parsed(RawRecord record) {
        return new RecordBlock(record.ordinal(), record, null);
    }

    public static RecordBlock unreadable(long ordinal, String errorMessage) {
        return new RecordBlock(ordinal, null, errorMessage);
    }

    public boolean isReadable() {
        return record != null;
    }
}
