package com.property.knowledge.source;

import com.property.knowledge.core.model.CandidateEntry;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.metrics.MetricsService;
import com.property.knowledge.normalize.RawRecord;
import com.property.knowledge.rules.CleanupRuleSet;
import com.property.knowledge.rules.DefaultCleanupRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceLoaderTest {

    private static final SourceTag PROPKEY_H = SourceTag.of("propkey_h");

    @Mock
    private MetricsService metricsService;

    @TempDir
    Path tempDir;

    private SourceLoader loader;
    private CleanupRuleSet rules;

    @BeforeEach
    void setUp() {
        loader = new SourceLoader(metricsService);
        rules = DefaultCleanupRules.forName(DefaultCleanupRules.PROPKEY_H).orElseThrow();
    }

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(SourceLoaderTest.class.getResource("/sources/" + name).toURI());
    }

    @Test
    @DisplayName("A source with one malformed record yields the other nine and reports one error")
    void testPartialFailure() throws URISyntaxException {
        CandidateSource source = loader.load(fixture("partial.yaml"), PROPKEY_H, rules);

        List<CandidateEntry> entries = source.entries();

        assertEquals(9, entries.size());
        LoadResult result = source.lastResult().orElseThrow();
        assertEquals(10, result.recordsRead());
        assertEquals(9, result.candidatesProduced());
        assertEquals(1, result.droppedCount());
        LoadResult.LoadError error = result.errors().get(0);
        assertEquals(5, error.ordinal());
        assertEquals("propkey_h#5", error.location());
        assertTrue(error.message().contains("not-a-guid"));

        verify(metricsService, times(9)).incrementCandidatesLoaded(PROPKEY_H);
        verify(metricsService).incrementRecordsDropped(PROPKEY_H);
    }

    @Test
    @DisplayName("Every candidate carries the source tag")
    void testCandidatesTagged() throws URISyntaxException {
        List<CandidateEntry> entries = loader.load(fixture("propkey_h.yaml"), PROPKEY_H, rules).entries();

        assertEquals(3, entries.size());
        assertTrue(entries.stream().allMatch(entry -> entry.source().equals(PROPKEY_H)));
        assertEquals("b725f130-47ef-101a-a5f1-02608c9eebac", entries.get(2).key().formatIdentifier());
    }

    @Test
    @DisplayName("Each pass re-reads the source from the start")
    void testRestartable() throws IOException {
        Path file = tempDir.resolve("restart.yaml");
        Files.writeString(file, """
                ---
                format_identifier: f29f85e0-4ff9-1068-ab91-08002b27b3d9
                property_identifier: 2
                name: System.Title
                """, StandardCharsets.UTF_8);
        CandidateSource source = loader.load(file, PROPKEY_H, rules);

        List<CandidateEntry> first = source.entries();
        List<CandidateEntry> second = source.entries();

        assertEquals(first, second);
        assertEquals(1, second.size());
    }

    @Test
    @DisplayName("Nothing is read until a pass is opened")
    void testLazy() {
        CandidateSource source = loader.load(tempDir.resolve("missing.yaml"), PROPKEY_H, rules);

        assertTrue(source.lastResult().isEmpty());
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("A missing source is unavailable, not empty")
    void testUnavailable() {
        CandidateSource source = loader.load(tempDir.resolve("missing.yaml"), PROPKEY_H, rules);

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, source::stream);
        assertEquals(PROPKEY_H, e.getSource());
        assertNotNull(e.getCause());
        verify(metricsService, never()).incrementSourceUnavailable(PROPKEY_H);
    }

    @Test
    @DisplayName("An undecodable byte only costs the record it sits in")
    void testUndecodableByte() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (int ordinal = 1; ordinal <= 10; ordinal++) {
            bytes.write("---\nformat_identifier: f29f85e0-4ff9-1068-ab91-".getBytes(StandardCharsets.UTF_8));
            if (ordinal == 6) {
                bytes.write(0xff);
            } else {
                bytes.write("08002b27b3d9".getBytes(StandardCharsets.UTF_8));
            }
            bytes.write(("\nproperty_identifier: " + ordinal + "\nname: System.Item" + ordinal + "\n")
                    .getBytes(StandardCharsets.UTF_8));
        }
        Path file = tempDir.resolve("bad-byte.yaml");
        Files.write(file, bytes.toByteArray());

        CandidateSource source = loader.load(file, PROPKEY_H, rules);
        List<CandidateEntry> entries = source.entries();

        assertEquals(9, entries.size());
        LoadResult result = source.lastResult().orElseThrow();
        assertEquals(10, result.recordsRead());
        assertEquals(1, result.droppedCount());
        assertEquals(6, result.errors().get(0).ordinal());
        assertEquals("propkey_h#6", result.errors().get(0).location());
    }

    @Test
    @DisplayName("A pass that fails part way publishes no load result")
    void testIncompletePass() throws IOException {
        Path file = tempDir.resolve("truncated.txt");
        Files.writeString(file, "ignored", StandardCharsets.UTF_8);
        RecordBlock first = RecordBlock.parsed(new RawRecord(PROPKEY_H, 1, Map.of(
                "format_identifier", "F29F85E0-4FF9-1068-AB91-08002B27B3D9",
                "property_identifier", "2",
                "name", "System.Title")));
        loader.registerReader(PROPKEY_H, (reader, tag) -> Stream.concat(Stream.of(first),
                Stream.<RecordBlock>generate(() -> {
                    throw new SourceUnavailableException(tag, "connection reset", null);
                })));
        CandidateSource source = loader.load(file, PROPKEY_H, rules);

        assertThrows(SourceUnavailableException.class, source::entries);
        assertTrue(source.lastResult().isEmpty());
    }

    @Test
    @DisplayName("An empty source yields no candidates")
    void testEmptySource() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "# winsps-kb property definitions\n", StandardCharsets.UTF_8);

        CandidateSource source = loader.load(file, PROPKEY_H, rules);

        assertTrue(source.entries().isEmpty());
        assertEquals(0, source.lastResult().orElseThrow().recordsRead());
    }

    @Test
    @DisplayName("A reader registered for a tag replaces the default layout")
    void testRegisteredReader() throws IOException {
        Path file = tempDir.resolve("custom.txt");
        Files.writeString(file, "ignored", StandardCharsets.UTF_8);
        RecordReader fixed = (reader, tag) -> Stream.of(RecordBlock.parsed(new RawRecord(tag, 1, Map.of(
                "format_identifier", "F29F85E0-4FF9-1068-AB91-08002B27B3D9",
                "property_identifier", "2",
                "name", "System.Title"))));
        loader.registerReader(PROPKEY_H, fixed);

        List<CandidateEntry> entries = loader.load(file, PROPKEY_H, rules).entries();

        assertEquals(1, entries.size());
        assertEquals("System.Title", entries.get(0).name());
    }

    @Test
    @DisplayName("In-memory sequences reject candidates from another source")
    void testInMemorySequence() {
        CandidateEntry foreign = CandidateEntry.builder()
                .key("f29f85e0-4ff9-1068-ab91-08002b27b3d9", 2)
                .source("win32docs")
                .build();

        assertThrows(IllegalArgumentException.class, () -> CandidateSequence.of(PROPKEY_H, List.of(foreign)));
    }
}
