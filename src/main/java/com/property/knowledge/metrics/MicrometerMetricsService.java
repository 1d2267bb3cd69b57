package com.property.knowledge.metrics;

import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.TargetFormat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code kb.candidates.loaded}: counter (tag: source)</li>
 *   <li>{@code kb.records.dropped}: counter (tag: source)</li>
 *   <li>{@code kb.sources.unavailable}: counter (tag: source)</li>
 *   <li>{@code kb.merge.duration}: timer</li>
 *   <li>{@code kb.entries.merged}: counter</li>
 *   <li>{@code kb.conflicts}: counter (tag: field)</li>
 *   <li>{@code kb.artifacts.written}: counter (tag: format)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer mergeTimer;
    private final Counter entriesMergedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergeTimer = Timer.builder("kb.merge.duration")
                .description("Duration of candidate merge runs")
                .register(registry);
        this.entriesMergedCounter = Counter.builder("kb.entries.merged")
                .description("Number of canonical entries produced by merge")
                .register(registry);
    }

    @Override
    public void incrementCandidatesLoaded(SourceTag source) {
        taggedCounter("kb.candidates.loaded", "Number of candidate entries loaded",
                "source", source.name()).increment();
    }

    @Override
    public void incrementRecordsDropped(SourceTag source) {
        taggedCounter("kb.records.dropped", "Number of source records dropped during normalization",
                "source", source.name()).increment();
    }

    @Override
    public void incrementSourceUnavailable(SourceTag source) {
        taggedCounter("kb.sources.unavailable", "Number of sources that could not be read",
                "source", source.name()).increment();
    }

    @Override
    public void recordMergeDuration(Duration duration) {
        mergeTimer.record(duration);
    }

    @Override
    public void recordEntriesMerged(long count) {
        entriesMergedCounter.increment(count);
    }

    @Override
    public void incrementConflict(RecordField field) {
        taggedCounter("kb.conflicts", "Number of field value conflicts resolved by precedence",
                "field", field.getKey()).increment();
    }

    @Override
    public void incrementArtifactWritten(TargetFormat format) {
        taggedCounter("kb.artifacts.written", "Number of generated artifacts written",
                "format", format.name()).increment();
    }

    private Counter taggedCounter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
