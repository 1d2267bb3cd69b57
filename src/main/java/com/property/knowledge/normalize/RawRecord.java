package com.property.knowledge.normalize;

import com.property.knowledge.core.model.SourceTag;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A semi-structured record as extracted from one source, before normalization.
 *
 * @param source  the source that produced the record
 * @param ordinal 1-based position of the record within its source stream
 * @param values  raw field values keyed by field name
 */
public record RawRecord(SourceTag source, long ordinal, Map<String, String> values) {

    public RawRecord {
        Objects.requireNonNull(source, "source is required");
        // TreeMap keeps diagnostics stable; Map.copyOf rejects null values
        values = values != null ? Collections.unmodifiableMap(new TreeMap<>(values)) : Map.of();
    }

    public String get(String key) {
        return values.get(key);
    }

    public String location() {
        return source.name() + "#" + ordinal;
    }
}
