package com.property.knowledge.config;

import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.TargetFormat;
import com.property.knowledge.merge.PrecedenceConfigurationException;
import com.property.knowledge.merge.PrecedencePolicy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a knowledge base generation run: the recognized sources with
 * their precedence and cleanup rules, and where generated artifacts go.
 */
public class PipelineConfig {

    public static final String DEFAULT_YAML_FILE = "defined_properties.yaml";
    public static final String DEFAULT_JAVA_PACKAGE = "com.property.knowledge.generated";
    public static final String DEFAULT_JAVA_CLASS = "ShellPropertyDefinitions";

    private final String precedencePolicyName;
    private final List<SourceDefinition> sources;
    private final Path outputDirectory;
    private final String yamlFileName;
    private final String javaPackage;
    private final String javaClassName;
    private final Set<TargetFormat> formats;

    private PipelineConfig(Builder builder) {
        this.precedencePolicyName = builder.precedencePolicyName;
        this.sources = List.copyOf(builder.sources);
        this.outputDirectory = builder.outputDirectory;
        this.yamlFileName = builder.yamlFileName;
        this.javaPackage = builder.javaPackage;
        this.javaClassName = builder.javaClassName;
        this.formats = builder.formats.isEmpty()
                ? Set.of() : Set.copyOf(builder.formats);
    }

    public String getPrecedencePolicyName() {
        return precedencePolicyName;
    }

    public List<SourceDefinition> getSources() {
        return sources;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public String getYamlFileName() {
        return yamlFileName;
    }

    public String getJavaPackage() {
        return javaPackage;
    }

    public String getJavaClassName() {
        return javaClassName;
    }

    /**
     * Output formats in declaration order of {@link TargetFormat}.
     */
    public List<TargetFormat> getFormats() {
        List<TargetFormat> ordered = new ArrayList<>();
        for (TargetFormat format : TargetFormat.values()) {
            if (formats.contains(format)) {
                ordered.add(format);
            }
        }
        return ordered;
    }

    /**
     * Builds the precedence policy over the configured sources.
     *
     * @throws PrecedenceConfigurationException if the ranks are invalid
     */
    public PrecedencePolicy precedencePolicy() {
        Map<SourceTag, Integer> ranks = new LinkedHashMap<>();
        Set<SourceTag> recognized = new LinkedHashSet<>();
        for (SourceDefinition source : sources) {
            recognized.add(source.tag());
            ranks.put(source.tag(), source.rank());
        }
        return PrecedencePolicy.of(precedencePolicyName, recognized, ranks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String precedencePolicyName;
        private final List<SourceDefinition> sources = new ArrayList<>();
        private Path outputDirectory = Path.of("build", "kb");
        private String yamlFileName = DEFAULT_YAML_FILE;
        private String javaPackage = DEFAULT_JAVA_PACKAGE;
        private String javaClassName = DEFAULT_JAVA_CLASS;
        private final Set<TargetFormat> formats = new LinkedHashSet<>(List.of(TargetFormat.values()));

        public Builder precedencePolicyName(String precedencePolicyName) {
            this.precedencePolicyName = precedencePolicyName;
            return this;
        }

        public Builder source(SourceDefinition source) {
            this.sources.add(Objects.requireNonNull(source, "source is required"));
            return this;
        }

        public Builder sources(List<SourceDefinition> sources) {
            this.sources.clear();
            sources.forEach(this::source);
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder yamlFileName(String yamlFileName) {
            this.yamlFileName = yamlFileName;
            return this;
        }

        public Builder javaPackage(String javaPackage) {
            this.javaPackage = javaPackage;
            return this;
        }

        public Builder javaClassName(String javaClassName) {
            this.javaClassName = javaClassName;
            return this;
        }

        public Builder formats(Set<TargetFormat> formats) {
            this.formats.clear();
            this.formats.addAll(formats);
            return this;
        }

        public PipelineConfig build() {
            if (precedencePolicyName == null || precedencePolicyName.isBlank()) {
                throw new PrecedenceConfigurationException("A named precedence policy is required");
            }
            if (sources.isEmpty()) {
                throw new ConfigurationException("At least one source is required");
            }
            Set<SourceTag> seen = new LinkedHashSet<>();
            for (SourceDefinition source : sources) {
                if (!seen.add(source.tag())) {
                    throw new ConfigurationException("Source configured twice: " + source.tag());
                }
            }
            Objects.requireNonNull(outputDirectory, "outputDirectory is required");
            Objects.requireNonNull(yamlFileName, "yamlFileName is required");
            Objects.requireNonNull(javaPackage, "javaPackage is required");
            Objects.requireNonNull(javaClassName, "javaClassName is required");
            PipelineConfig config = new PipelineConfig(this);
            // fail fast on an inconsistent policy, before any source is read
            config.precedencePolicy();
            return config;
        }
    }
}
