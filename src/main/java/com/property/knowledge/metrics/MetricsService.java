package com.property.knowledge.metrics;

import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.TargetFormat;

import java.time.Duration;

/**
 * Interface for recording knowledge base generation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs
 * without any metrics registry configured.
 */
public interface MetricsService {

    void incrementCandidatesLoaded(SourceTag source);

    void incrementRecordsDropped(SourceTag source);

    void incrementSourceUnavailable(SourceTag source);

    void recordMergeDuration(Duration duration);

    void recordEntriesMerged(long count);

    void incrementConflict(RecordField field);

    void incrementArtifactWritten(TargetFormat format);
}
