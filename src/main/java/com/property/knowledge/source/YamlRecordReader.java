package com.property.knowledge.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.normalize.RawRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads property definitions in the block-structured YAML layout:
 *
 * <pre>
 * # winsps-kb property definitions
 * ---
 * format_identifier: d5cdd502-2e9c-101b-9397-08002b2cf9ae
 * name: System.Title
 * property_identifier: 2
 * shell_property_key: PKEY_Title
 * </pre>
 *
 * <p>Each {@code ---} line starts a new record. Blocks are parsed one at a time,
 * so a malformed block is reported on its own and its neighbours still load.
 * List values ({@code name: [A, B]}) collapse to their first value in sorted order.</p>
 */
public class YamlRecordReader implements RecordReader {

    static final String SEPARATOR = "---";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public Stream<RecordBlock> read(BufferedReader reader, SourceTag source) {
        Iterator<RecordBlock> iterator = new BlockIterator(reader, source);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Parses the text of one block into a record block.
     */
    RecordBlock parseBlock(String text, long ordinal, SourceTag source) {
        Map<String, Object> parsed;
        try {
            parsed = YAML_MAPPER.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            return RecordBlock.unreadable(ordinal, "Unparsable record: " + e.getOriginalMessage());
        }
        if (parsed == null || parsed.isEmpty()) {
            return RecordBlock.unreadable(ordinal, "Empty record");
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : parsed.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Map<?, ?>) {
                return RecordBlock.unreadable(ordinal, "Nested value for key: " + entry.getKey());
            }
            String scalar = value instanceof List<?> list ? firstSorted(list) : value.toString();
            if (scalar != null) {
                values.put(entry.getKey(), scalar);
            }
        }
        return RecordBlock.parsed(new RawRecord(source, ordinal, values));
    }

    private static String firstSorted(List<?> values) {
        return values.stream()
                .filter(value -> value != null && !(value instanceof Map<?, ?>) && !(value instanceof List<?>))
                .map(Object::toString)
                .sorted()
                .findFirst()
                .orElse(null);
    }

    private final class BlockIterator implements Iterator<RecordBlock> {
        private final BufferedReader reader;
        private final SourceTag source;
        private final List<String> pending = new ArrayList<>();
        private RecordBlock next;
        private long ordinal;
        private boolean exhausted;

        private BlockIterator(BufferedReader reader, SourceTag source) {
            this.reader = reader;
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public RecordBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RecordBlock block = next;
            next = null;
            return block;
        }

        private RecordBlock advance() {
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.strip().equals(SEPARATOR)) {
                        RecordBlock block = flush();
                        if (block != null) {
                            return block;
                        }
                    } else {
                        pending.add(line);
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                throw new SourceUnavailableException(source, "Failed reading source " + source + ": " + e.getMessage(), e);
            }
            exhausted = true;
            return flush();
        }

        private RecordBlock flush() {
            boolean hasContent = pending.stream()
                    .map(String::strip)
                    .anyMatch(line -> !line.isEmpty() && !line.startsWith("#"));
            if (!hasContent) {
                pending.clear();
                return null;
            }
            String text = String.join("\n", pending);
            pending.clear();
            ordinal++;
            return parseBlock(text, ordinal, source);
        }
    }
}
