package com.property.knowledge.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The single resolved record for one property key, as held by the knowledge base.
 * Immutable; created by the merge engine from one or more candidates.
 */
public record CanonicalEntry(
        PropertyKey key,
        String name,
        String valueType,
        String formatClass,
        String alias,
        String shellPropertyKey,
        SortedSet<SourceTag> provenance
) {
    public CanonicalEntry {
        Objects.requireNonNull(key, "key is required");
        name = CandidateEntry.emptyToNull(name);
        valueType = CandidateEntry.emptyToNull(valueType);
        formatClass = CandidateEntry.emptyToNull(formatClass);
        alias = CandidateEntry.emptyToNull(alias);
        shellPropertyKey = CandidateEntry.emptyToNull(shellPropertyKey);
        provenance = provenance != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(provenance))
                : Collections.emptySortedSet();
    }

    public String formatIdentifier() {
        return key.formatIdentifier();
    }

    public long propertyIdentifier() {
        return key.propertyIdentifier();
    }

    public String get(RecordField field) {
        return switch (field) {
            case NAME -> name;
            case SHELL_PROPERTY_KEY -> shellPropertyKey;
            case FORMAT_CLASS -> formatClass;
            case ALIAS -> alias;
            case VALUE_TYPE -> valueType;
        };
    }

    /**
     * Returns the set optional fields in declaration order.
     */
    public Map<RecordField, String> fields() {
        Map<RecordField, String> fields = new EnumMap<>(RecordField.class);
        for (RecordField field : RecordField.values()) {
            String value = get(field);
            if (value != null) {
                fields.put(field, value);
            }
        }
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Compares key and field values, ignoring provenance.
     */
    public boolean sameContentAs(CanonicalEntry other) {
        return other != null
                && key.equals(other.key)
                && fields().equals(other.fields());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PropertyKey key;
        private final Map<RecordField, String> fields = new EnumMap<>(RecordField.class);
        private final SortedSet<SourceTag> provenance = new TreeSet<>();

        public Builder key(PropertyKey key) {
            this.key = key;
            return this;
        }

        public Builder key(String formatIdentifier, long propertyIdentifier) {
            this.key = PropertyKey.of(formatIdentifier, propertyIdentifier);
            return this;
        }

        public Builder field(RecordField field, String value) {
            if (value == null) {
                fields.remove(field);
            } else {
                fields.put(field, value);
            }
            return this;
        }

        public Builder name(String name) {
            return field(RecordField.NAME, name);
        }

        public Builder valueType(String valueType) {
            return field(RecordField.VALUE_TYPE, valueType);
        }

        public Builder formatClass(String formatClass) {
            return field(RecordField.FORMAT_CLASS, formatClass);
        }

        public Builder alias(String alias) {
            return field(RecordField.ALIAS, alias);
        }

        public Builder shellPropertyKey(String shellPropertyKey) {
            return field(RecordField.SHELL_PROPERTY_KEY, shellPropertyKey);
        }

        public Builder addProvenance(SourceTag source) {
            provenance.add(source);
            return this;
        }

        public CanonicalEntry build() {
            return new CanonicalEntry(key,
                    fields.get(RecordField.NAME),
                    fields.get(RecordField.VALUE_TYPE),
                    fields.get(RecordField.FORMAT_CLASS),
                    fields.get(RecordField.ALIAS),
                    fields.get(RecordField.SHELL_PROPERTY_KEY),
                    provenance);
        }
    }
}
