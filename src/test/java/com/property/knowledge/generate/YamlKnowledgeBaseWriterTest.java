package com.property.knowledge.generate;

import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.kb.KnowledgeBase;
import com.property.knowledge.merge.MergeEngine;
import com.property.knowledge.merge.PrecedencePolicy;
import com.property.knowledge.rules.CleanupRuleSet;
import com.property.knowledge.source.SourceLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class YamlKnowledgeBaseWriterTest {

    private static final String SUMMARY_INFORMATION = "f29f85e0-4ff9-1068-ab91-08002b27b3d9";

    @TempDir
    Path tempDir;

    private YamlKnowledgeBaseWriter writer;
    private KnowledgeBase kb;

    @BeforeEach
    void setUp() {
        writer = new YamlKnowledgeBaseWriter();
        kb = KnowledgeBase.builder()
                .add(CanonicalEntry.builder()
                        .key(SUMMARY_INFORMATION, 2)
                        .name("System.Title")
                        .shellPropertyKey("PKEY_Title")
                        .formatClass("FMTID_SummaryInformation")
                        .alias("PIDSI_TITLE")
                        .valueType("0x001f")
                        .addProvenance(SourceTag.of("propkey_h"))
                        .build())
                .add(CanonicalEntry.builder()
                        .key(SUMMARY_INFORMATION, 4)
                        .name("System.Author")
                        .valueType("VT_VECTOR | VT_LPWSTR")
                        .build())
                .add(CanonicalEntry.builder()
                        .key("b725f130-47ef-101a-a5f1-02608c9eebac", 12)
                        .build())
                .build();
    }

    private String render(KnowledgeBase knowledgeBase) throws IOException {
        StringWriter out = new StringWriter();
        writer.write(knowledgeBase, out);
        return out.toString();
    }

    @Test
    @DisplayName("Output starts with the header and has one document per entry")
    void testLayout() throws IOException {
        String yaml = render(kb);

        assertTrue(yaml.startsWith(YamlKnowledgeBaseWriter.HEADER + "\n---\n"));
        assertEquals(3, yaml.split("(?m)^---$").length - 1);
    }

    @Test
    @DisplayName("Keys appear in a fixed order")
    void testKeyOrder() {
        Map<String, Object> document = YamlKnowledgeBaseWriter.toDocument(kb.entries().get(1));

        assertEquals(List.of("name", "shell_property_key", "format_identifier", "format_class",
                "property_identifier", "alias", "value_type"), List.copyOf(document.keySet()));
        assertEquals(2L, document.get("property_identifier"));
    }

    @Test
    @DisplayName("Absent fields are omitted rather than written empty")
    void testAbsentFieldsOmitted() throws IOException {
        Map<String, Object> keyOnly = YamlKnowledgeBaseWriter.toDocument(kb.entries().get(0));
        String yaml = render(kb);

        assertEquals(List.of("format_identifier", "property_identifier"), List.copyOf(keyOnly.keySet()));
        assertFalse(yaml.contains("null"));
        assertFalse(yaml.contains("~"));
    }

    @Test
    @DisplayName("Rendering the same knowledge base twice gives identical bytes")
    void testIdempotent() throws IOException {
        Path first = tempDir.resolve("first.yaml");
        Path second = tempDir.resolve("second.yaml");

        writer.generate(kb, first);
        writer.generate(kb, second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    @DisplayName("The written file loads back into an equivalent knowledge base")
    void testRoundTrip() {
        Path file = tempDir.resolve("defined_properties.yaml");
        GenerationResult result = writer.generate(kb, file);

        SourceTag tag = SourceTag.of("persisted");
        KnowledgeBase reloaded = new MergeEngine(PrecedencePolicy.ordered("persisted", List.of(tag)))
                .merge(List.of(new SourceLoader().load(file, tag, CleanupRuleSet.empty("none"))))
                .knowledgeBase();

        assertEquals(3, result.entriesWritten());
        assertEquals(TargetFormat.YAML, result.format());
        assertTrue(kb.equivalentTo(reloaded));
    }

    @Test
    @DisplayName("An empty knowledge base writes only the header")
    void testEmpty() throws IOException {
        assertEquals(YamlKnowledgeBaseWriter.HEADER + "\n", render(KnowledgeBase.empty()));
    }

    @Test
    @DisplayName("A target that cannot be written fails with its path")
    void testWriteFailure() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory", StandardCharsets.UTF_8);
        Path target = blocker.resolve("defined_properties.yaml");

        GenerationWriteException e = assertThrows(GenerationWriteException.class, () -> writer.generate(kb, target));

        assertEquals(target, e.getPath());
        assertTrue(e.getMessage().contains(target.toString()));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("A failed write leaves the previous artifact in place")
    void testPreviousArtifactKept() throws IOException {
        Path target = tempDir.resolve("defined_properties.yaml");
        writer.generate(kb, target);
        byte[] before = Files.readAllBytes(target);

        ResourceGenerator failing = new ResourceGenerator() {
            @Override
            public TargetFormat getFormat() {
                return TargetFormat.YAML;
            }

            @Override
            public long write(KnowledgeBase knowledgeBase, Writer out) throws IOException {
                out.write("partial");
                throw new IOException("disk full");
            }
        };

        assertThrows(GenerationWriteException.class, () -> failing.generate(kb, target));
        assertArrayEquals(before, Files.readAllBytes(target));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}
