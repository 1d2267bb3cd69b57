package com.property.knowledge.source;

import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.metrics.MetricsService;
import com.property.knowledge.metrics.NoOpMetricsService;
import com.property.knowledge.normalize.RecordNormalizer;
import com.property.knowledge.rules.CleanupRuleSet;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Creates candidate sequences for sources on disk.
 *
 * <p>The record layout of each source is decided by a {@link RecordReader} registered
 * for its tag; sources without a registered reader use the YAML definitions layout.
 * Loading is lazy: nothing is read until a pass is opened.</p>
 */
public class SourceLoader {

    private final RecordReader defaultReader;
    private final Map<SourceTag, RecordReader> readers = new HashMap<>();
    private final MetricsService metricsService;

    public SourceLoader() {
        this(new YamlRecordReader(), new NoOpMetricsService());
    }

    public SourceLoader(MetricsService metricsService) {
        this(new YamlRecordReader(), metricsService);
    }

    public SourceLoader(RecordReader defaultReader, MetricsService metricsService) {
        this.defaultReader = Objects.requireNonNull(defaultReader, "defaultReader is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Registers a reader for one source's record layout.
     */
    public SourceLoader registerReader(SourceTag tag, RecordReader reader) {
        readers.put(Objects.requireNonNull(tag, "tag is required"),
                Objects.requireNonNull(reader, "reader is required"));
        return this;
    }

    /**
     * Creates a lazy, restartable candidate sequence for one source.
     *
     * @param sourcePath path of the source's record stream
     * @param sourceTag  the source's tag, recorded on every candidate
     * @param rules      cleanup rules applied to the source's optional fields
     */
    public CandidateSource load(Path sourcePath, SourceTag sourceTag, CleanupRuleSet rules) {
        Objects.requireNonNull(sourcePath, "sourcePath is required");
        Objects.requireNonNull(sourceTag, "sourceTag is required");
        RecordReader reader = readers.getOrDefault(sourceTag, defaultReader);
        return new CandidateSource(sourceTag, sourcePath, reader, new RecordNormalizer(rules), metricsService);
    }
}
