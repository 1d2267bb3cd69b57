package com.property.knowledge.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Optional metadata fields of a property record, with their keys in the
 * persisted definitions format. Merge resolves each field independently.
 */
public enum RecordField {
    NAME("name"),
    SHELL_PROPERTY_KEY("shell_property_key"),
    FORMAT_CLASS("format_class"),
    ALIAS("alias"),
    VALUE_TYPE("value_type");

    private final String key;

    RecordField(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<RecordField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equals(key))
                .findFirst();
    }
}
