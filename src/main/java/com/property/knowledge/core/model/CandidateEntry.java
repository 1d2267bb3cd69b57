package com.property.knowledge.core.model;

import java.util.Objects;

/**
 * One source's claim about one property key, after normalization.
 * Blank optional values are stored as {@code null}.
 */
public record CandidateEntry(
        PropertyKey key,
        String name,
        String valueType,
        String formatClass,
        String alias,
        String shellPropertyKey,
        SourceTag source
) {
    public CandidateEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(source, "source is required");
        name = emptyToNull(name);
        valueType = emptyToNull(valueType);
        formatClass = emptyToNull(formatClass);
        alias = emptyToNull(alias);
        shellPropertyKey = emptyToNull(shellPropertyKey);
    }

    /**
     * Returns the value of the given optional field, or {@code null} if this source is silent on it.
     */
    public String get(RecordField field) {
        return switch (field) {
            case NAME -> name;
            case SHELL_PROPERTY_KEY -> shellPropertyKey;
            case FORMAT_CLASS -> formatClass;
            case ALIAS -> alias;
            case VALUE_TYPE -> valueType;
        };
    }

    public boolean hasAnyField() {
        for (RecordField field : RecordField.values()) {
            if (get(field) != null) {
                return true;
            }
        }
        return false;
    }

    static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PropertyKey key;
        private String name;
        private String valueType;
        private String formatClass;
        private String alias;
        private String shellPropertyKey;
        private SourceTag source;

        public Builder key(PropertyKey key) {
            this.key = key;
            return this;
        }

        public Builder key(String formatIdentifier, long propertyIdentifier) {
            this.key = PropertyKey.of(formatIdentifier, propertyIdentifier);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder valueType(String valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder formatClass(String formatClass) {
            this.formatClass = formatClass;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder shellPropertyKey(String shellPropertyKey) {
            this.shellPropertyKey = shellPropertyKey;
            return this;
        }

        public Builder field(RecordField field, String value) {
            switch (field) {
                case NAME -> this.name = value;
                case SHELL_PROPERTY_KEY -> this.shellPropertyKey = value;
                case FORMAT_CLASS -> this.formatClass = value;
                case ALIAS -> this.alias = value;
                case VALUE_TYPE -> this.valueType = value;
            }
            return this;
        }

        public Builder source(SourceTag source) {
            this.source = source;
            return this;
        }

        public Builder source(String source) {
            this.source = SourceTag.of(source);
            return this;
        }

        public CandidateEntry build() {
            return new CandidateEntry(key, name, valueType, formatClass, alias, shellPropertyKey, source);
        }
    }
}
