package com.property.knowledge.pipeline;

import com.property.knowledge.config.PipelineConfig;
import com.property.knowledge.config.SourceDefinition;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.GenerationResult;
import com.property.knowledge.generate.JavaLookupSourceGenerator;
import com.property.knowledge.generate.ResourceGenerator;
import com.property.knowledge.generate.TargetFormat;
import com.property.knowledge.generate.YamlKnowledgeBaseWriter;
import com.property.knowledge.kb.KnowledgeBase;
import com.property.knowledge.logging.LogContext;
import com.property.knowledge.merge.MergeEngine;
import com.property.knowledge.merge.MergeResult;
import com.property.knowledge.metrics.MetricsService;
import com.property.knowledge.metrics.NoOpMetricsService;
import com.property.knowledge.source.CandidateSource;
import com.property.knowledge.source.LoadResult;
import com.property.knowledge.source.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs load, merge and generation for one configuration.
 *
 * <pre>{@code
 * RunSummary summary = KnowledgeBasePipeline.builder()
 *         .config(new PipelineConfigLoader().load(Path.of("pipeline.yaml")))
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build()
 *         .run();
 * }</pre>
 */
public class KnowledgeBasePipeline {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBasePipeline.class);

    private final PipelineConfig config;
    private final SourceLoader sourceLoader;
    private final MetricsService metricsService;
    private final MergeEngine mergeEngine;

    private KnowledgeBasePipeline(Builder builder) {
        this.config = builder.config;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.sourceLoader = builder.sourceLoader != null ? builder.sourceLoader : new SourceLoader(metricsService);
        this.mergeEngine = new MergeEngine(config.precedencePolicy(), metricsService);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * Loads every configured source and merges them, without writing anything.
     */
    public MergeResult merge() {
        return mergeEngine.merge(openSources());
    }

    /**
     * Loads, merges and writes every configured artifact.
     *
     * @throws com.property.knowledge.source.SourceUnavailableException if no source could be read
     * @throws com.property.knowledge.generate.GenerationWriteException if an artifact cannot be written
     */
    public RunSummary run() {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.starting sources={} formats={} output={}",
                    config.getSources().size(), config.getFormats(), config.getOutputDirectory());

            List<CandidateSource> sources = openSources();
            MergeResult mergeResult = mergeEngine.merge(sources);

            SortedMap<SourceTag, LoadResult> loads = new TreeMap<>();
            for (CandidateSource source : sources) {
                source.lastResult().ifPresent(result -> loads.put(source.tag(), result));
            }

            List<GenerationResult> artifacts = new ArrayList<>();
            for (TargetFormat format : config.getFormats()) {
                artifacts.add(generate(format, mergeResult.knowledgeBase()));
            }

            RunSummary summary = new RunSummary(runId, loads, mergeResult, artifacts);
            log.info("run.completed entries={} conflicts={} dropped={} unavailable={} artifacts={}",
                    summary.entryCount(), summary.conflictCount(), summary.droppedRecords(),
                    summary.unavailableSources(), artifacts.size());
            return summary;
        }
    }

    /**
     * Writes one artifact for an already merged knowledge base.
     */
    public GenerationResult generate(TargetFormat format, KnowledgeBase knowledgeBase) {
        try (LogContext ctx = LogContext.forGeneration(format.name())) {
            ResourceGenerator generator = generatorFor(format);
            Path target = targetFor(format);
            GenerationResult result = generator.generate(knowledgeBase, target);
            metricsService.incrementArtifactWritten(format);
            log.info("generate.completed format={} path={} entries={}", format, target, result.entriesWritten());
            return result;
        }
    }

    Path targetFor(TargetFormat format) {
        switch (format) {
            case YAML:
                return config.getOutputDirectory().resolve(config.getYamlFileName());
            case JAVA_SOURCE:
                return config.getOutputDirectory().resolve(javaGenerator().relativePath());
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    private ResourceGenerator generatorFor(TargetFormat format) {
        switch (format) {
            case YAML:
                return new YamlKnowledgeBaseWriter();
            case JAVA_SOURCE:
                return javaGenerator();
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    private JavaLookupSourceGenerator javaGenerator() {
        return new JavaLookupSourceGenerator(config.getJavaPackage(), config.getJavaClassName());
    }

    private List<CandidateSource> openSources() {
        List<CandidateSource> sources = new ArrayList<>();
        for (SourceDefinition definition : config.getSources()) {
            sources.add(sourceLoader.load(definition.path(), definition.tag(), definition.rules()));
        }
        return sources;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config;
        private SourceLoader sourceLoader;
        private MetricsService metricsService;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder sourceLoader(SourceLoader sourceLoader) {
            this.sourceLoader = sourceLoader;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public KnowledgeBasePipeline build() {
            Objects.requireNonNull(config, "config is required");
            return new KnowledgeBasePipeline(this);
        }
    }
}
