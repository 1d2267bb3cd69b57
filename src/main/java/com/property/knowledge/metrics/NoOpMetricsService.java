package com.property.knowledge.metrics;

import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.TargetFormat;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementCandidatesLoaded(SourceTag source) {
    }

    @Override
    public void incrementRecordsDropped(SourceTag source) {
    }

    @Override
    public void incrementSourceUnavailable(SourceTag source) {
    }

    @Override
    public void recordMergeDuration(Duration duration) {
    }

    @Override
    public void recordEntriesMerged(long count) {
    }

    @Override
    public void incrementConflict(RecordField field) {
    }

    @Override
    public void incrementArtifactWritten(TargetFormat format) {
    }
}
