package com.property.knowledge.kb;

import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.normalize.GuidFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Immutable collection of canonical entries keyed by property key.
 *
 * <p>Iteration order is format identifier, then property identifier, so every
 * artifact generated from a knowledge base is stable across runs. Instances
 * are never mutated after {@link Builder#build()} and can be shared between
 * threads without locking.</p>
 */
public final class KnowledgeBase implements Iterable<CanonicalEntry> {

    private final NavigableMap<PropertyKey, CanonicalEntry> entries;

    private KnowledgeBase(NavigableMap<PropertyKey, CanonicalEntry> entries) {
        this.entries = Collections.unmodifiableNavigableMap(new TreeMap<>(entries));
    }

    public static KnowledgeBase empty() {
        return new KnowledgeBase(new TreeMap<>());
    }

    /**
     * Looks up an entry by key.
     */
    public Optional<CanonicalEntry> lookup(PropertyKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Looks up an entry by format identifier and property identifier.
     * The format identifier may be in any GUID notation; it is canonicalized first.
     *
     * @throws com.property.knowledge.normalize.MalformedIdentifierException if the format identifier is not a GUID
     */
    public Optional<CanonicalEntry> lookup(String formatIdentifier, long propertyIdentifier) {
        if (propertyIdentifier < 0 || propertyIdentifier > PropertyKey.MAX_PROPERTY_IDENTIFIER) {
            return Optional.empty();
        }
        return lookup(PropertyKey.of(GuidFormat.canonicalize(formatIdentifier), propertyIdentifier));
    }

    public boolean contains(PropertyKey key) {
        return entries.containsKey(key);
    }

    /**
     * Returns a new ordered stream over all entries. Each call starts from the first entry.
     */
    public Stream<CanonicalEntry> stream() {
        return entries.values().stream();
    }

    /**
     * Returns all entries in key order.
     */
    public List<CanonicalEntry> entries() {
        return List.copyOf(entries.values());
    }

    /**
     * Groups entries by format identifier (property set), both levels in key order.
     */
    public SortedMap<String, List<CanonicalEntry>> propertySets() {
        SortedMap<String, List<CanonicalEntry>> sets = new TreeMap<>();
        for (CanonicalEntry entry : entries.values()) {
            sets.computeIfAbsent(entry.formatIdentifier(), k -> new ArrayList<>()).add(entry);
        }
        sets.replaceAll((formatIdentifier, list) -> List.copyOf(list));
        return Collections.unmodifiableSortedMap(sets);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Checks that both knowledge bases hold the same keys with the same field values.
     * Provenance is not compared.
     */
    public boolean equivalentTo(KnowledgeBase other) {
        if (other == null || other.size() != size()) {
            return false;
        }
        for (Map.Entry<PropertyKey, CanonicalEntry> entry : entries.entrySet()) {
            if (!entry.getValue().sameContentAs(other.entries.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<CanonicalEntry> iterator() {
        return entries.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((KnowledgeBase) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "KnowledgeBase{entries=" + entries.size() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final NavigableMap<PropertyKey, CanonicalEntry> entries = new TreeMap<>();

        /**
         * Adds an entry.
         *
         * @throws IllegalStateException if an entry with the same key was already added
         */
        public Builder add(CanonicalEntry entry) {
            CanonicalEntry existing = entries.putIfAbsent(entry.key(), entry);
            if (existing != null) {
                throw new IllegalStateException("Duplicate property key: " + entry.key());
            }
            return this;
        }

        public KnowledgeBase build() {
            return new KnowledgeBase(entries);
        }
    }
}
