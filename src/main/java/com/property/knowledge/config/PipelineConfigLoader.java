package com.property.knowledge.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.generate.TargetFormat;
import com.property.knowledge.rules.CleanupRule;
import com.property.knowledge.rules.CleanupRuleSet;
import com.property.knowledge.rules.DefaultCleanupRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a {@link PipelineConfig} from YAML.
 *
 * <pre>
 * precedence_policy: header-constants-first
 * sources:
 *   - tag: propkey_h
 *     path: build/propkey.h.yaml
 *     rank: 1
 *     rules: propkey_h
 * output:
 *   directory: build/kb
 *   formats: [YAML, JAVA_SOURCE]
 * </pre>
 *
 * Relative paths resolve against the directory holding the configuration file.
 */
public class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    /** Classpath location of the bundled configuration. */
    public static final String DEFAULT_RESOURCE = "/default-pipeline.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Loads configuration from a file.
     *
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public PipelineConfig load(Path configFile) {
        Path absolute = configFile.toAbsolutePath();
        try (Reader reader = Files.newBufferedReader(absolute, StandardCharsets.UTF_8)) {
            ConfigDocument document = YAML_MAPPER.readValue(reader, ConfigDocument.class);
            PipelineConfig config = toConfig(document, absolute.getParent());
            log.info("config.loaded file={} sources={} policy={}",
                    absolute, config.getSources().size(), config.getPrecedencePolicyName());
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid pipeline configuration " + absolute + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read pipeline configuration " + absolute, e);
        }
    }

    /**
     * Loads the bundled configuration; its relative paths resolve against {@code baseDirectory}.
     */
    public PipelineConfig loadDefault(Path baseDirectory) {
        try (InputStream in = PipelineConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Bundled configuration not found: " + DEFAULT_RESOURCE);
            }
            ConfigDocument document = YAML_MAPPER.readValue(in, ConfigDocument.class);
            return toConfig(document, baseDirectory.toAbsolutePath());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid bundled configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read bundled configuration " + DEFAULT_RESOURCE, e);
        }
    }

    PipelineConfig toConfig(ConfigDocument document, Path baseDirectory) {
        if (document == null) {
            throw new ConfigurationException("Pipeline configuration is empty");
        }
        PipelineConfig.Builder builder = PipelineConfig.builder()
                .precedencePolicyName(document.precedencePolicy());

        if (document.sources() == null || document.sources().isEmpty()) {
            throw new ConfigurationException("At least one source is required");
        }
        for (SourceDocument source : document.sources()) {
            builder.source(toSourceDefinition(source, baseDirectory));
        }

        OutputDocument output = document.output();
        if (output != null) {
            if (output.directory() != null) {
                builder.outputDirectory(resolve(baseDirectory, output.directory()));
            }
            if (output.yamlFile() != null) {
                builder.yamlFileName(output.yamlFile());
            }
            if (output.javaPackage() != null) {
                builder.javaPackage(output.javaPackage());
            }
            if (output.javaClass() != null) {
                builder.javaClassName(output.javaClass());
            }
            if (output.formats() != null) {
                builder.formats(parseFormats(output.formats()));
            }
        } else {
            builder.outputDirectory(baseDirectory.resolve(Path.of("build", "kb")));
        }
        return builder.build();
    }

    private SourceDefinition toSourceDefinition(SourceDocument source, Path baseDirectory) {
        if (source.tag() == null || source.path() == null) {
            throw new ConfigurationException("Every source needs a tag and a path");
        }
        SourceTag tag;
        try {
            tag = SourceTag.of(source.tag());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid source tag: " + source.tag(), e);
        }
        if (source.rank() == null) {
            throw new ConfigurationException("Source has no rank: " + tag);
        }

        String ruleSetName = source.rules() != null ? source.rules() : DefaultCleanupRules.COMMON;
        CleanupRuleSet rules = DefaultCleanupRules.forName(ruleSetName)
                .orElseThrow(() -> new ConfigurationException("Unknown cleanup rule set '" + ruleSetName
                        + "' for source " + tag + ", known: " + DefaultCleanupRules.names()));
        if (source.extraRules() != null && !source.extraRules().isEmpty()) {
            List<CleanupRule> extra = new ArrayList<>();
            for (RuleDocument rule : source.extraRules()) {
                extra.add(toRule(rule, tag));
            }
            rules = rules.with(extra);
        }
        return new SourceDefinition(tag, resolve(baseDirectory, source.path()), source.rank(), rules);
    }

    private CleanupRule toRule(RuleDocument rule, SourceTag tag) {
        if (rule.name() == null || rule.pattern() == null) {
            throw new ConfigurationException("Extra rule for source " + tag + " needs a name and a pattern");
        }
        Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
        if (rule.fields() != null) {
            for (String key : rule.fields()) {
                fields.add(RecordField.fromKey(key).orElseThrow(() ->
                        new ConfigurationException("Unknown field '" + key + "' in rule " + rule.name())));
            }
        }
        try {
            return CleanupRule.of(rule.name(), rule.pattern(),
                    rule.replacement() != null ? rule.replacement() : "",
                    rule.priority() != null ? rule.priority() : CleanupRule.DEFAULT_PRIORITY, fields);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid pattern in rule " + rule.name() + ": " + e.getDescription(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid rule for source " + tag + ": " + e.getMessage(), e);
        }
    }

    private static Set<TargetFormat> parseFormats(List<String> names) {
        Set<TargetFormat> formats = EnumSet.noneOf(TargetFormat.class);
        for (String name : names) {
            try {
                formats.add(TargetFormat.valueOf(name.strip().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown output format: " + name, e);
            }
        }
        return formats;
    }

    private static Path resolve(Path baseDirectory, String value) {
        try {
            Path path = Path.of(value);
            return path.isAbsolute() ? path : baseDirectory.resolve(path).normalize();
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Invalid path: " + value, e);
        }
    }

    record ConfigDocument(
            @JsonProperty("precedence_policy") String precedencePolicy,
            @JsonProperty("sources") List<SourceDocument> sources,
            @JsonProperty("output") OutputDocument output) {}

    record SourceDocument(
            @JsonProperty("tag") String tag,
            @JsonProperty("path") String path,
            @JsonProperty("rank") Integer rank,
            @JsonProperty("rules") String rules,
            @JsonProperty("extra_rules") List<RuleDocument> extraRules) {}

    record RuleDocument(
            @JsonProperty("name") String name,
            @JsonProperty("pattern") String pattern,
            @JsonProperty("replacement") String replacement,
            @JsonProperty("fields") List<String> fields,
            @JsonProperty("priority") Integer priority) {}

    record OutputDocument(
            @JsonProperty("directory") String directory,
            @JsonProperty("yaml_file") String yamlFile,
            @JsonProperty("java_package") String javaPackage,
            @JsonProperty("java_class") String javaClass,
            @JsonProperty("formats") List<String> formats) {}
}
