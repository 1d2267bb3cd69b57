package com.property.knowledge.normalize;

import com.property.knowledge.core.model.CandidateEntry;

/**
 * Result of normalizing one raw record: either a candidate entry or the reason it was dropped.
 */
public record NormalizationResult(
        CandidateEntry entry,
        RawRecord record,
        String errorMessage
) {

    public static NormalizationResult success(CandidateEntry entry, RawRecord record) {
        return new NormalizationResult(entry, record, null);
    }

    public static NormalizationResult failure(RawRecord record, String errorMessage) {
        return new NormalizationResult(null, record, errorMessage);
    }

    public boolean isSuccess() {
        return entry != null;
    }

    public boolean isFailure() {
        return entry == null;
    }
}
